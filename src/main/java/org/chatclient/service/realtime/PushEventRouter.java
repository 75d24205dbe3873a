package org.chatclient.service.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.dto.ConversationPayload;
import org.chatclient.dto.NewMessageEvent;
import org.chatclient.dto.PushEnvelope;
import org.chatclient.service.fetch.UserDirectory;
import org.chatclient.service.loop.EventLoop;

/**
 * Point d'entrée du canal temps réel : décode l'enveloppe {type, payload} et confie
 * le traitement à la boucle. Un événement illisible est journalisé puis ignoré,
 * le canal reste à l'écoute.
 */
@Slf4j
public class PushEventRouter {

    public static final String MESSAGE_NEW = "message:new";
    public static final String CONVERSATION_UPDATED = "conversation:updated";
    public static final String CONVERSATION_CREATED = "conversation:created";
    public static final String ONLINE_USERS = "onlineUsers";
    public static final String USER_CREATED = "user:created";

    private final ObjectMapper objectMapper;
    private final EventLoop loop;
    private final ConversationEventReconciler reconciler;
    private final PresenceTracker presence;
    private final UserDirectory users;

    public PushEventRouter(ObjectMapper objectMapper, EventLoop loop, ConversationEventReconciler reconciler,
                           PresenceTracker presence, UserDirectory users) {
        this.objectMapper = objectMapper;
        this.loop = loop;
        this.reconciler = reconciler;
        this.presence = presence;
        this.users = users;
    }

    /** Trame brute reçue du transport (thread du transport). */
    public void onFrame(String json) {
        PushEnvelope envelope;
        try {
            envelope = objectMapper.readValue(json, PushEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Trame push illisible ignorée : {}", e.getOriginalMessage());
            return;
        }
        onEnvelope(envelope);
    }

    /** Enveloppe déjà décodée par le transport. */
    public void onEnvelope(PushEnvelope envelope) {
        if (envelope == null || envelope.getType() == null) {
            log.warn("Trame push sans type ignorée");
            return;
        }
        loop.post(() -> dispatch(envelope));
    }

    /** Exécuté sur la boucle. Ne lève jamais. */
    public void dispatch(PushEnvelope envelope) {
        try {
            JsonNode payload = envelope.getPayload();
            switch (envelope.getType()) {
                case MESSAGE_NEW -> reconciler.onMessageNew(read(payload, NewMessageEvent.class));
                case CONVERSATION_UPDATED -> reconciler.onConversationUpdated(read(payload, ConversationPayload.class));
                case CONVERSATION_CREATED -> reconciler.onConversationCreated(read(payload, ConversationPayload.class));
                case ONLINE_USERS -> presence.onOnlineUsers(payload);
                case USER_CREATED -> users.onUserCreated();
                default -> log.debug("Événement push inconnu : {}", envelope.getType());
            }
        } catch (JsonProcessingException e) {
            log.warn("Payload {} invalide ignoré : {}", envelope.getType(), e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Traitement de l'événement {} en échec", envelope.getType(), e);
        }
    }

    // payload absent : le handler reçoit null et l'ignore
    private <T> T read(JsonNode payload, Class<T> type) throws JsonProcessingException {
        if (payload == null || payload.isNull() || payload.isMissingNode()) return null;
        return objectMapper.treeToValue(payload, type);
    }
}
