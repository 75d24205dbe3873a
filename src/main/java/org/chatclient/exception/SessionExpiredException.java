package org.chatclient.exception;

// 401 / 403 : la session n'est plus valide, pas de nouvelle tentative
public class SessionExpiredException extends ChatApiException {
    public SessionExpiredException(int status) {
        super(status, "Session expirée (" + status + ")");
    }
}
