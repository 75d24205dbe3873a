package org.chatclient.service.ingress;

import org.chatclient.dto.MessageRecord;
import org.chatclient.dto.PushMessage;
import org.chatclient.model.Message;

import java.util.List;
import java.util.Objects;

public final class MessageMapper {
    private MessageMapper() {}

    public static Message fromRecord(MessageRecord r, String currentUserId) {
        return Message.builder()
                .id(r.getId())
                .content(r.getMessage() != null ? r.getMessage() : "")
                .timestamp(r.getCreatedAt())
                .sentByCurrentUser(currentUserId != null && Objects.equals(r.getSenderId(), currentUserId))
                .build();
    }

    public static List<Message> fromRecords(List<MessageRecord> records, String currentUserId) {
        if (records == null) return List.of();
        return records.stream()
                .filter(r -> r != null && r.getId() != null)
                .map(r -> fromRecord(r, currentUserId))
                .toList();
    }

    public static Message fromPush(PushMessage m, String currentUserId) {
        return Message.builder()
                .id(m.getId())
                .content(m.getContent() != null ? m.getContent() : "")
                .timestamp(m.getCreatedAt())
                .sentByCurrentUser(currentUserId != null && Objects.equals(m.getSenderId(), currentUserId))
                .build();
    }
}
