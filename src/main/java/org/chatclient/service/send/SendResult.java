package org.chatclient.service.send;

public enum SendResult {
    SENT,
    /** Message vide ou destinataire introuvable : rien n'est parti. */
    REJECTED,
    FAILED,
    SESSION_EXPIRED
}
