package org.chatclient.exception;

import lombok.Getter;

/** Échec d'un appel REST. status = 0 quand le serveur n'a pas répondu. */
@Getter
public class ChatApiException extends RuntimeException {
    private final int status;

    public ChatApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ChatApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
