package org.chatclient.service.store;

import org.chatclient.model.Conversation;
import org.chatclient.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

public final class ConversationLists {
    private ConversationLists() {}

    public static Optional<Conversation> find(List<Conversation> list, String id) {
        if (id == null) return Optional.empty();
        return list.stream().filter(c -> id.equals(c.getId())).findFirst();
    }

    public static boolean contains(List<Conversation> list, String id) {
        return find(list, id).isPresent();
    }

    /** Applique {@code patch} à la conversation {@code id} ; liste inchangée si absente. */
    public static List<Conversation> patch(List<Conversation> list, String id, UnaryOperator<Conversation> patch) {
        if (!contains(list, id)) return list;
        List<Conversation> out = new ArrayList<>(list.size());
        for (Conversation c : list) {
            out.add(id.equals(c.getId()) ? patch.apply(c) : c);
        }
        return out;
    }

    public static List<Conversation> clearUnread(List<Conversation> list, String id) {
        return find(list, id).filter(c -> c.getUnreadCount() != 0)
                .map(c -> patch(list, id, x -> x.withUnreadCount(0)))
                .orElse(list);
    }

    public static List<Conversation> append(List<Conversation> list, Conversation c) {
        List<Conversation> out = new ArrayList<>(list);
        out.add(c);
        return out;
    }

    /** Une conversation ouverte est lue : son compteur reste à zéro. */
    public static ChatState withSelectedRead(ChatState state) {
        String selectedId = state.selectedId();
        if (selectedId == null) return state;
        return state.withConversations(clearUnread(state.getConversations(), selectedId));
    }

    /**
     * Cible de la conversation temporaire sélectionnée, ou null si la sélection
     * n'est pas temporaire.
     */
    public static User temporaryTarget(ChatState state) {
        Conversation selected = state.getSelectedConversation();
        return selected != null && selected.isTemporary() ? selected.firstParticipant() : null;
    }

    /**
     * La conversation réelle {@code real} remplace la sélection temporaire : elle devient
     * la sélection, lue, et les messages envoyés pendant la fenêtre temporaire sont gardés.
     * La liste des conversations n'est pas touchée.
     */
    public static ChatState adoptForTemporary(ChatState state, Conversation real) {
        Conversation adopted = hydrateFrom(real, state.getSelectedConversation()).withUnreadCount(0);
        return state.withSelectedConversation(adopted)
                .withMessages(MessageLists.sentByCurrentUser(state.getMessages()));
    }

    /** Après un rechargement : si la liste contient déjà la conversation de la cible, on l'adopte. */
    public static ChatState resolveTemporarySelection(ChatState state) {
        User target = temporaryTarget(state);
        if (target == null || target.getId() == null) return state;
        return state.getConversations().stream()
                .filter(c -> !c.isTemporary() && c.hasParticipant(target.getId()))
                .findFirst()
                .map(real -> withSelectedRead(adoptForTemporary(state, real)))
                .orElse(state);
    }

    /** Complète les participants réduits à un id avec ceux connus de {@code known}. */
    static Conversation hydrateFrom(Conversation conversation, Conversation known) {
        if (known == null) return conversation;
        List<User> participants = conversation.getParticipants().stream()
                .map(p -> p == null || p.hasDisplayName() ? p : known.getParticipants().stream()
                        .filter(k -> k != null && Objects.equals(k.getId(), p.getId()))
                        .findFirst()
                        .orElse(p))
                .toList();
        return conversation.toBuilder().clearParticipants().participants(participants).build();
    }
}
