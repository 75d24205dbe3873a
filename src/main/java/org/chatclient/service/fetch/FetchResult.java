package org.chatclient.service.fetch;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Issue d'un chargement : la valeur, une session expirée (non rejouable)
 * ou un échec transitoire (rejouable).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult<T> {
    public enum Status { OK, SESSION_EXPIRED, FAILED }

    Status status;
    T value;
    Throwable error;

    public static <T> FetchResult<T> ok(T value) {
        return new FetchResult<>(Status.OK, value, null);
    }

    public static <T> FetchResult<T> sessionExpired() {
        return new FetchResult<>(Status.SESSION_EXPIRED, null, null);
    }

    public static <T> FetchResult<T> failed(Throwable error) {
        return new FetchResult<>(Status.FAILED, null, error);
    }

    public boolean isOk() { return status == Status.OK; }
    public boolean isSessionExpired() { return status == Status.SESSION_EXPIRED; }
    public boolean isRetryable() { return status == Status.FAILED; }
}
