package org.chatclient.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.exception.SessionExpiredException;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;

/** Conversion commune d'un échec réseau en résultat + notification. */
@Slf4j
final class FetchFailures {
    private FetchFailures() {}

    static <T> FetchResult<T> handle(Throwable error, String userMessage,
                                     AuthFailureHandler authFailure, NotificationCenter notifier) {
        Throwable cause = EventLoop.unwrap(error);
        if (cause instanceof SessionExpiredException) {
            authFailure.onSessionExpired();
            return FetchResult.sessionExpired();
        }
        log.warn("{} : {}", userMessage, cause.getMessage());
        notifier.error(userMessage);
        return FetchResult.failed(cause);
    }
}
