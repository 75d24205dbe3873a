package org.chatclient.service.selection;

import org.chatclient.model.Conversation;
import org.chatclient.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Contenu de la barre latérale pour un terme de recherche. Fonction pure.
 * <ul>
 *   <li>terme vide : toutes les conversations ;</li>
 *   <li>sinon : les conversations dont l'interlocuteur correspond, puis les utilisateurs
 *   sans conversation avec l'utilisateur courant qui correspondent.</li>
 * </ul>
 * Aucun tri au-delà de ce découpage : l'ordre d'entrée est conservé.
 */
public final class ConversationFilter {

    public static final int DEFAULT_MAX_RESULTS = 30;
    public static final String NO_CONVERSATIONS = "No conversations found";
    public static final String NO_MATCHES = "No matches found";

    private ConversationFilter() {}

    public static FilterResult filter(String searchTerm, List<Conversation> conversations, List<User> users,
                                      String currentUserId, Conversation selected) {
        return filter(searchTerm, conversations, users, currentUserId, selected, DEFAULT_MAX_RESULTS);
    }

    public static FilterResult filter(String searchTerm, List<Conversation> conversations, List<User> users,
                                      String currentUserId, Conversation selected, int maxResults) {
        List<Conversation> convs = conversations != null ? conversations : List.of();
        List<User> directory = users != null ? users : List.of();
        String selectedId = selected != null ? selected.getId() : null;

        if (searchTerm == null || searchTerm.isBlank()) {
            List<DisplayItem> items = convs.stream()
                    .map(c -> DisplayItem.of(c, Objects.equals(c.getId(), selectedId)))
                    .toList();
            return new FilterResult(items, items.isEmpty() ? NO_CONVERSATIONS : null, false);
        }

        String term = searchTerm.trim().toLowerCase(Locale.ROOT);
        String tempTargetId = selected != null && selected.isTemporary() && selected.firstParticipant() != null
                ? selected.firstParticipant().getId()
                : null;

        List<DisplayItem> items = new ArrayList<>();
        for (Conversation c : convs) {
            if (matches(c.otherParticipant(currentUserId), term)) {
                items.add(DisplayItem.of(c, Objects.equals(c.getId(), selectedId)));
            }
        }
        for (User u : directory) {
            if (u == null || u.getId() == null || u.getId().equals(currentUserId)) continue;
            if (hasConversationWith(convs, u.getId()) || !matches(u, term)) continue;
            items.add(DisplayItem.of(u, u.getId().equals(tempTargetId)));
        }

        List<DisplayItem> capped = items.size() > maxResults ? items.subList(0, maxResults) : items;
        return new FilterResult(List.copyOf(capped), capped.isEmpty() ? NO_MATCHES : null, true);
    }

    private static boolean hasConversationWith(List<Conversation> conversations, String userId) {
        return conversations.stream().anyMatch(c -> !c.isTemporary() && c.hasParticipant(userId));
    }

    private static boolean matches(User user, String term) {
        if (user == null) return false;
        return contains(user.getFullName(), term) || contains(user.getUsername(), term);
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }
}
