package org.chatclient.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder(toBuilder = true)
public class Message {
    String id;
    String content;
    String timestamp;            // ISO-8601
    boolean sentByCurrentUser;
    @With boolean fresh;         // affichage seulement, jamais persisté
    @With boolean pending;       // envoi optimiste pas encore confirmé
}
