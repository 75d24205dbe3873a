package org.chatclient.service.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.config.ChatProperties;
import org.chatclient.config.SessionCookieInterceptor;
import org.chatclient.dto.StoredIdentity;
import org.chatclient.events.SessionEndedEvent;
import org.chatclient.events.SessionStartedEvent;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.auth.SessionStorage;
import org.chatclient.service.fetch.ConversationFetcher;
import org.chatclient.service.fetch.MessageFetcher;
import org.chatclient.service.fetch.UserDirectory;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.loop.KeyedTimers;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.notify.NotificationSound;
import org.chatclient.service.read.MarkReadScheduler;
import org.chatclient.service.realtime.ConversationEventReconciler;
import org.chatclient.service.realtime.PresenceTracker;
import org.chatclient.service.realtime.PushEventRouter;
import org.chatclient.service.selection.SelectionService;
import org.chatclient.service.send.OptimisticSendPipeline;
import org.chatclient.service.store.ConversationStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cycle de vie des sessions : une seule active à la fois, construite au login,
 * détruite au logout ou sur 401/403.
 */
@Slf4j
@Service
public class ChatSessionManager implements AuthFailureHandler {

    static final String SESSION_EXPIRED = "Session expirée";

    private final ChatApiClient api;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService chatLoop;
    private final ExecutorService chatIo;
    private final NotificationCenter notifier;
    private final NotificationSound sound;
    private final ChatProperties props;
    private final Clock clock;
    private final SessionStorage storage;
    private final SessionCookieInterceptor cookies;
    private final ApplicationEventPublisher events;

    private final AtomicReference<ChatSession> current = new AtomicReference<>();

    public ChatSessionManager(ChatApiClient api, ObjectMapper objectMapper,
                              @Qualifier("chatLoop") ScheduledExecutorService chatLoop,
                              @Qualifier("chatIo") ExecutorService chatIo,
                              NotificationCenter notifier, NotificationSound sound,
                              ChatProperties props, Clock clock, SessionStorage storage,
                              SessionCookieInterceptor cookies, ApplicationEventPublisher events) {
        this.api = api;
        this.objectMapper = objectMapper;
        this.chatLoop = chatLoop;
        this.chatIo = chatIo;
        this.notifier = notifier;
        this.sound = sound;
        this.props = props;
        this.clock = clock;
        this.storage = storage;
        this.cookies = cookies;
        this.events = events;
    }

    public ChatSession start(StoredIdentity identity) {
        if (identity == null || identity.getId() == null) {
            throw new IllegalArgumentException("Identité de session manquante");
        }
        end(false);
        ChatSession session = build(identity);
        current.set(session);
        session.start();
        events.publishEvent(new SessionStartedEvent(session));
        return session;
    }

    /** Déconnexion volontaire. */
    public void end() {
        end(false);
    }

    public ChatSession current() {
        return current.get();
    }

    public boolean isActive() {
        return current.get() != null;
    }

    /** 401/403 sur n'importe quel appel : retour à l'état non authentifié, sans nouvelle tentative. */
    @Override
    public void onSessionExpired() {
        storage.clear();
        cookies.clear();
        // plusieurs appels peuvent échouer en même temps : un seul message
        if (end(true)) {
            notifier.error(SESSION_EXPIRED);
        }
    }

    private boolean end(boolean expired) {
        ChatSession session = current.getAndSet(null);
        if (session == null) return false;
        session.close();
        events.publishEvent(new SessionEndedEvent(session.getUserId(), expired));
        return true;
    }

    ChatSession build(StoredIdentity identity) {
        String userId = identity.getId();
        EventLoop loop = new EventLoop(chatIo, chatLoop);
        ConversationStore store = new ConversationStore();
        KeyedTimers timers = new KeyedTimers(chatLoop);
        PresenceTracker presence = new PresenceTracker();

        ConversationFetcher conversationFetcher = new ConversationFetcher(api, store, loop, notifier, this);
        MessageFetcher messageFetcher = new MessageFetcher(api, store, loop, notifier, this, userId);
        UserDirectory userDirectory = new UserDirectory(api, loop, notifier, this, presence);
        MarkReadScheduler markRead = new MarkReadScheduler(timers, store, api, loop, this,
                props.getMarkReadDelayMs());
        ConversationEventReconciler reconciler = new ConversationEventReconciler(store, userId, markRead, timers,
                sound, props.getFreshDelayMs());
        PushEventRouter router = new PushEventRouter(objectMapper, loop, reconciler, presence, userDirectory);
        OptimisticSendPipeline sendPipeline = new OptimisticSendPipeline(api, store, loop, notifier, this,
                conversationFetcher, userId, clock);
        SelectionService selection = new SelectionService(store, messageFetcher, markRead, userDirectory, userId,
                clock, props.getSearchMaxResults(), props.getMobileBreakpointPx());

        return new ChatSession(userId, identity.getUsername(), store, timers, conversationFetcher, messageFetcher,
                userDirectory, presence, markRead, reconciler, router, sendPipeline, selection);
    }
}
