package org.chatclient.service.realtime;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.config.SessionCookieInterceptor;
import org.chatclient.dto.PushEnvelope;
import org.chatclient.events.SessionEndedEvent;
import org.chatclient.events.SessionStartedEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpHeaders;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Canal temps réel STOMP : ouvert au démarrage d'une session, fermé à sa fin.
 * Les enveloppes reçues partent vers le {@link PushEventRouter} de la session.
 * Pas de reconnexion automatique.
 */
@Slf4j
@Component
public class StompPushChannel {

    static final List<String> DESTINATIONS = List.of("/user/queue/events", "/topic/events");

    private final WebSocketStompClient client;
    private final SessionCookieInterceptor cookies;
    private final String url;
    private final AtomicReference<StompSession> active = new AtomicReference<>();
    // incrémentée à chaque fermeture : une poignée de main plus ancienne est refermée à l'arrivée
    private final AtomicLong generation = new AtomicLong();

    public StompPushChannel(WebSocketStompClient client, SessionCookieInterceptor cookies,
                            @Value("${chat.ws.url:ws://localhost:5000/ws}") String url) {
        this.client = client;
        this.cookies = cookies;
        this.url = url;
    }

    @EventListener
    public void onSessionStarted(SessionStartedEvent e) {
        connect(e.getSession().getRouter());
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent e) {
        disconnect();
    }

    void connect(PushEventRouter router) {
        disconnect();
        WebSocketHttpHeaders handshake = new WebSocketHttpHeaders();
        String cookie = cookies.cookieHeader();
        if (cookie != null) handshake.add(HttpHeaders.COOKIE, cookie);

        client.connectAsync(url, handshake, new StompHeaders(), new Handler(router, generation.get()))
                .whenComplete((session, error) -> {
                    if (error != null) {
                        log.warn("Connexion temps réel impossible ({}) : {}", url, error.getMessage());
                    }
                });
    }

    public void disconnect() {
        generation.incrementAndGet();
        StompSession session = active.getAndSet(null);
        if (session != null && session.isConnected()) {
            session.disconnect();
            log.info("Canal temps réel fermé");
        }
    }

    public boolean isConnected() {
        StompSession session = active.get();
        return session != null && session.isConnected();
    }

    StompFrameHandler frameHandler(PushEventRouter router) {
        return new StompFrameHandler() {
            @Override
            public Type getPayloadType(StompHeaders headers) {
                return PushEnvelope.class;
            }

            @Override
            public void handleFrame(StompHeaders headers, Object payload) {
                if (payload instanceof PushEnvelope envelope) {
                    router.onEnvelope(envelope);
                }
            }
        };
    }

    private class Handler extends StompSessionHandlerAdapter {
        private final PushEventRouter router;
        private final long connectGeneration;

        Handler(PushEventRouter router, long connectGeneration) {
            this.router = router;
            this.connectGeneration = connectGeneration;
        }

        @Override
        public void afterConnected(StompSession session, StompHeaders connectedHeaders) {
            if (connectGeneration != generation.get()) {
                log.info("Connexion temps réel périmée, fermée");
                session.disconnect();
                return;
            }
            StompSession previous = active.getAndSet(session);
            if (previous != null && previous.isConnected()) previous.disconnect();
            if (connectGeneration != generation.get()) {
                active.compareAndSet(session, null);
                session.disconnect();
                return;
            }
            for (String destination : DESTINATIONS) {
                session.subscribe(destination, frameHandler(router));
            }
            log.info("Canal temps réel connecté ({})", url);
        }

        // trame illisible : journalisée, le canal reste ouvert
        @Override
        public void handleException(StompSession session, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.warn("Trame temps réel ignorée : {}", exception.getMessage());
        }

        @Override
        public void handleTransportError(StompSession session, Throwable exception) {
            log.warn("Canal temps réel interrompu : {}", exception.getMessage());
            active.compareAndSet(session, null);
        }
    }
}
