package org.chatclient.events;

import lombok.Value;
import org.chatclient.service.session.ChatSession;

/** Publié quand une session authentifiée démarre ; le transport temps réel s'y connecte. */
@Value
public class SessionStartedEvent {
    ChatSession session;
}
