package org.chatclient.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Le serveur pose le JWT dans un cookie httpOnly "jwt" : on le garde et on le rejoue
 * sur chaque requête REST et sur la poignée de main WebSocket. Il est persisté avec
 * l'identité locale pour survivre à un redémarrage.
 */
@Slf4j
@Component
public class SessionCookieInterceptor implements ClientHttpRequestInterceptor {

    static final String COOKIE_NAME = "jwt";

    private volatile String token;

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body,
                                        ClientHttpRequestExecution execution) throws IOException {
        String current = token;
        if (current != null) {
            request.getHeaders().add(HttpHeaders.COOKIE, COOKIE_NAME + "=" + current);
        }
        ClientHttpResponse response = execution.execute(request, body);
        capture(response.getHeaders().get(HttpHeaders.SET_COOKIE));
        return response;
    }

    void capture(List<String> setCookies) {
        if (setCookies == null) return;
        for (String header : setCookies) {
            String first = header.split(";", 2)[0].trim();
            if (!first.startsWith(COOKIE_NAME + "=")) continue;
            String value = first.substring(COOKIE_NAME.length() + 1);
            // logout : le serveur renvoie un cookie vide
            token = value.isBlank() ? null : value;
            log.debug("Cookie de session {}", token == null ? "effacé" : "reçu");
        }
    }

    /** Valeur de l'en-tête Cookie à rejouer, ou null. */
    public String cookieHeader() {
        String current = token;
        return current == null ? null : COOKIE_NAME + "=" + current;
    }

    /** Jeton courant, à persister avec l'identité. */
    public String token() {
        return token;
    }

    /** Rejoue un jeton persisté lors d'un lancement précédent. */
    public void restore(String saved) {
        token = saved == null || saved.isBlank() ? null : saved;
    }

    public void clear() {
        token = null;
    }
}
