package org.chatclient.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Objects;

@Value
@Builder(toBuilder = true)
public class Conversation {
    public static final String TEMP_PREFIX = "temp_";

    String id;
    @Singular List<User> participants;
    @With LastMessage lastMessage;   // null tant qu'aucun message
    @With int unreadCount;

    /** Conversation locale pas encore créée côté serveur. */
    public static Conversation temporary(User target, long nowMs) {
        return Conversation.builder()
                .id(TEMP_PREFIX + nowMs)
                .participant(target)
                .unreadCount(0)
                .build();
    }

    public static boolean isTemporaryId(String id) {
        return id != null && id.startsWith(TEMP_PREFIX);
    }

    public boolean isTemporary() {
        return isTemporaryId(id);
    }

    public boolean hasParticipant(String userId) {
        if (userId == null) return false;
        return participants.stream().anyMatch(p -> p != null && userId.equals(p.getId()));
    }

    public User firstParticipant() {
        return participants.isEmpty() ? null : participants.get(0);
    }

    /** Le participant qui n'est pas l'utilisateur courant (à défaut, le premier). */
    public User otherParticipant(String currentUserId) {
        if (isTemporary()) return firstParticipant();
        return participants.stream()
                .filter(p -> p != null && !Objects.equals(p.getId(), currentUserId))
                .findFirst()
                .orElse(firstParticipant());
    }
}
