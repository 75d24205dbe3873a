package org.chatclient.events;

import lombok.Value;

@Value
public class SessionEndedEvent {
    String userId;
    boolean expired;   // fin sur 401/403 plutôt que déconnexion volontaire
}
