package org.chatclient.service.store;

import org.chatclient.model.Message;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transitions pures sur la liste des messages. Un id n'apparaît qu'une fois,
 * et un message en attente et sa confirmation serveur ne forment qu'une entrée.
 */
public final class MessageLists {
    private MessageLists() {}

    public static boolean containsId(List<Message> list, String id) {
        return indexOf(list, id) >= 0;
    }

    public static int indexOf(List<Message> list, String id) {
        if (id == null) return -1;
        for (int i = 0; i < list.size(); i++) {
            if (id.equals(list.get(i).getId())) return i;
        }
        return -1;
    }

    /** Ajout en fin de liste, sans doublon, en gardant les horodatages croissants. */
    public static List<Message> append(List<Message> list, Message m) {
        if (containsId(list, m.getId())) return list;
        List<Message> out = new ArrayList<>(list);
        int at = out.size();
        Instant ts = parse(m.getTimestamp());
        if (ts != null) {
            // remonte tant que le précédent est strictement plus récent
            while (at > 0) {
                Instant prev = parse(out.get(at - 1).getTimestamp());
                if (prev == null || !prev.isAfter(ts)) break;
                at--;
            }
        }
        out.add(at, m);
        return out;
    }

    /**
     * Message reçu par le canal temps réel. L'écho d'un message que l'on a envoyé
     * prend la place de l'entrée en attente de même contenu.
     */
    public static List<Message> mergeIncoming(List<Message> list, Message m) {
        if (containsId(list, m.getId())) return list;
        if (m.isSentByCurrentUser()) {
            for (int i = 0; i < list.size(); i++) {
                Message candidate = list.get(i);
                if (candidate.isPending() && Objects.equals(candidate.getContent(), m.getContent())) {
                    List<Message> out = new ArrayList<>(list);
                    out.set(i, m.withPending(false));
                    return out;
                }
            }
        }
        return append(list, m);
    }

    /**
     * Phase 2 de l'envoi optimiste : l'entrée {@code pendingId} devient {@code confirmed},
     * à la même position. Si elle a disparu, on ajoute la confirmation seulement si
     * {@code appendIfMissing} et qu'aucune entrée ne porte déjà son id.
     */
    public static List<Message> promote(List<Message> list, String pendingId, Message confirmed,
                                        boolean appendIfMissing) {
        int idx = indexOf(list, pendingId);
        if (idx < 0) {
            if (containsId(list, confirmed.getId()) || !appendIfMissing) return list;
            return append(list, confirmed);
        }
        List<Message> out = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Message m = list.get(i);
            if (i == idx) {
                out.add(confirmed);
            } else if (!Objects.equals(m.getId(), confirmed.getId())) {
                out.add(m);
            }
        }
        return out;
    }

    /** Retrait d'une entrée par son id exact ; rien d'autre n'est touché. */
    public static List<Message> remove(List<Message> list, String id) {
        if (!containsId(list, id)) return list;
        List<Message> out = new ArrayList<>(list);
        out.removeIf(m -> id.equals(m.getId()));
        return out;
    }

    public static List<Message> clearFresh(List<Message> list, String id) {
        int idx = indexOf(list, id);
        if (idx < 0 || !list.get(idx).isFresh()) return list;
        List<Message> out = new ArrayList<>(list);
        out.set(idx, out.get(idx).withFresh(false));
        return out;
    }

    /** Entrées envoyées par l'utilisateur courant (confirmées ou en attente). */
    public static List<Message> sentByCurrentUser(List<Message> list) {
        return list.stream().filter(Message::isSentByCurrentUser).toList();
    }

    static Instant parse(String timestamp) {
        if (timestamp == null) return null;
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
