package org.chatclient.service.auth;

/** Réaction à un 401/403 reçu sur n'importe quel appel de la session. */
@FunctionalInterface
public interface AuthFailureHandler {
    void onSessionExpired();
}
