package org.chatclient.model;

import lombok.Value;

/** Forme canonique : {@code content} jamais null. */
@Value
public class LastMessage {
    String content;
    String createdAt;
    String senderId;

    public LastMessage(String content, String createdAt, String senderId) {
        this.content = content != null ? content : "";
        this.createdAt = createdAt;
        this.senderId = senderId;
    }
}
