package org.chatclient.service.read;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.exception.SessionExpiredException;
import org.chatclient.model.Conversation;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.loop.KeyedTimers;
import org.chatclient.service.store.ConversationLists;
import org.chatclient.service.store.ConversationStore;

/**
 * Accusés de lecture groupés par conversation : un appel répété avant le délai
 * relance le minuteur, une rafale de messages ne produit qu'une requête.
 */
@Slf4j
public class MarkReadScheduler {

    static final String KEY_PREFIX = "read:";

    private final KeyedTimers timers;
    private final ConversationStore store;
    private final ChatApiClient api;
    private final EventLoop loop;
    private final AuthFailureHandler authFailure;
    private final long delayMs;

    public MarkReadScheduler(KeyedTimers timers, ConversationStore store, ChatApiClient api,
                             EventLoop loop, AuthFailureHandler authFailure, long delayMs) {
        this.timers = timers;
        this.store = store;
        this.api = api;
        this.loop = loop;
        this.authFailure = authFailure;
        this.delayMs = delayMs;
    }

    public void schedule(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) return;
        // une conversation temporaire n'existe pas côté serveur
        if (Conversation.isTemporaryId(conversationId)) return;
        timers.schedule(KEY_PREFIX + conversationId, delayMs, () -> fire(conversationId));
    }

    void fire(String conversationId) {
        store.updateConversations(list -> ConversationLists.clearUnread(list, conversationId));
        loop.run(() -> api.markRead(conversationId))
                .exceptionally(e -> {
                    Throwable cause = EventLoop.unwrap(e);
                    if (cause instanceof SessionExpiredException) {
                        authFailure.onSessionExpired();
                    } else {
                        // les patchs conversation:updated suivants rétabliront le compteur
                        log.debug("Accusé de lecture ignoré pour {} : {}", conversationId, cause.getMessage());
                    }
                    return null;
                });
    }

    public boolean isScheduled(String conversationId) {
        return timers.isPending(KEY_PREFIX + conversationId);
    }

    public void cancelAll() {
        timers.cancelAllOf(KEY_PREFIX);
    }
}
