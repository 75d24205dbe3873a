package org.chatclient.service.ingress;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.dto.ConversationPayload;
import org.chatclient.dto.UserPayload;
import org.chatclient.model.Conversation;
import org.chatclient.model.LastMessage;
import org.chatclient.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point d'entrée unique des formes serveur vers les formes canoniques.
 * Ne lève jamais : un champ mal formé retombe sur sa valeur par défaut
 * (liste vide, lastMessage null, compteur 0).
 */
@Slf4j
public final class ConversationNormalizer {
    private ConversationNormalizer() {}

    public static List<Conversation> normalizeAll(List<ConversationPayload> payloads) {
        if (payloads == null) return List.of();
        List<Conversation> out = new ArrayList<>(payloads.size());
        for (ConversationPayload p : payloads) {
            if (p == null || p.getId() == null) {
                log.warn("Conversation sans id ignorée");
                continue;
            }
            out.add(toConversation(p));
        }
        return out;
    }

    public static Conversation toConversation(ConversationPayload p) {
        return Conversation.builder()
                .id(p.getId())
                .participants(participants(p.getParticipants()))
                .lastMessage(lastMessage(p.getLastMessage()))
                .unreadCount(Math.max(0, unreadCount(p.getUnreadCount(), 0)))
                .build();
    }

    /**
     * lastMessage venu du serveur : {content}, {message} (ancienne forme) ou une simple chaîne.
     * content = content ?? message ?? "".
     */
    public static LastMessage lastMessage(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return new LastMessage(node.asText(), null, null);
        if (!node.isObject()) return null;
        String content = text(node, "content");
        if (content == null) content = text(node, "message");
        return new LastMessage(content, text(node, "createdAt"), senderId(node));
    }

    /** Idempotent sur la forme canonique. */
    public static LastMessage normalize(LastMessage m) {
        if (m == null) return null;
        return new LastMessage(m.getContent(), m.getCreatedAt(), m.getSenderId());
    }

    /** Participants en objets complets ou en ids bruts ; tout le reste est ignoré. */
    public static List<User> participants(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<User> out = new ArrayList<>();
        for (JsonNode p : node) {
            if (p == null || p.isNull()) continue;
            if (p.isTextual()) {
                out.add(User.ofId(p.asText()));
            } else if (p.isObject()) {
                String id = text(p, "_id");
                if (id == null) id = text(p, "id");
                out.add(User.builder()
                        .id(id)
                        .fullName(text(p, "fullName"))
                        .username(text(p, "username"))
                        .profilePicture(text(p, "profilePicture"))
                        .createdAt(text(p, "createdAt"))
                        .build());
            }
        }
        return out;
    }

    public static User toUser(UserPayload p) {
        return User.builder()
                .id(p.getId())
                .fullName(p.getFullName())
                .username(p.getUsername())
                .profilePicture(p.getProfilePicture())
                .createdAt(p.getCreatedAt())
                .build();
    }

    public static List<User> toUsers(List<UserPayload> payloads) {
        if (payloads == null) return List.of();
        return payloads.stream().filter(Objects::nonNull).map(ConversationNormalizer::toUser).toList();
    }

    /** Compteur du serveur si c'est un nombre, sinon {@code fallback}. */
    public static int unreadCount(JsonNode node, int fallback) {
        return node != null && node.isNumber() ? node.asInt() : fallback;
    }

    public static boolean hasUnreadCount(JsonNode node) {
        return node != null && node.isNumber();
    }

    private static String senderId(JsonNode node) {
        String id = text(node, "senderId");
        if (id != null) return id;
        JsonNode sender = node.get("sender");
        if (sender == null || sender.isNull()) return null;
        if (sender.isTextual()) return sender.asText();
        return text(sender, "_id");
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() || v.isContainerNode() ? null : v.asText();
    }
}
