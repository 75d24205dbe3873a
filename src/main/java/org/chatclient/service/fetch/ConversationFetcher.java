package org.chatclient.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.model.Conversation;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.ingress.ConversationNormalizer;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.store.ConversationLists;
import org.chatclient.service.store.ConversationStore;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Charge la liste des conversations et la remplace en bloc dans le store.
 * En cas d'échec le store n'est pas touché.
 */
@Slf4j
public class ConversationFetcher {

    static final String LOAD_FAILED = "Impossible de charger les conversations";

    private final ChatApiClient api;
    private final ConversationStore store;
    private final EventLoop loop;
    private final NotificationCenter notifier;
    private final AuthFailureHandler authFailure;
    private final AtomicBoolean hydrationTriggered = new AtomicBoolean();

    public ConversationFetcher(ChatApiClient api, ConversationStore store, EventLoop loop,
                               NotificationCenter notifier, AuthFailureHandler authFailure) {
        this.api = api;
        this.store = store;
        this.loop = loop;
        this.notifier = notifier;
        this.authFailure = authFailure;
    }

    public CompletableFuture<FetchResult<List<Conversation>>> fetchConversations() {
        return loop.call(api::getConversations)
                .thenApply(payloads -> {
                    List<Conversation> normalized = ConversationNormalizer.normalizeAll(payloads);
                    // la conversation ouverte reste lue, quoi qu'en dise le serveur ; une sélection
                    // temporaire dont la conversation existe désormais est remplacée
                    store.update(s -> ConversationLists.withSelectedRead(
                            ConversationLists.resolveTemporarySelection(s.withConversations(normalized))));
                    log.debug("{} conversations chargées", normalized.size());
                    return FetchResult.ok(normalized);
                })
                .exceptionally(e -> FetchFailures.handle(e, LOAD_FAILED, authFailure, notifier));
    }

    /**
     * Contrôle d'hydratation à usage unique : si un participant n'a pas de nom affichable
     * (id brut), on relance un chargement complet une seule fois pour toute la session.
     */
    public boolean checkHydration(List<Conversation> conversations) {
        if (conversations == null || conversations.isEmpty()) return false;
        if (hydrationTriggered.get()) return false;
        if (!needsHydration(conversations)) return false;
        if (!hydrationTriggered.compareAndSet(false, true)) return false;
        log.info("Participants incomplets : rechargement des conversations");
        fetchConversations();
        return true;
    }

    static boolean needsHydration(List<Conversation> conversations) {
        return conversations.stream().anyMatch(c ->
                c.getParticipants().isEmpty()
                        || c.getParticipants().stream().anyMatch(ConversationFetcher::incomplete));
    }

    private static boolean incomplete(User p) {
        return p == null || p.getId() == null || !p.hasDisplayName();
    }
}
