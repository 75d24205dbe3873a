package org.chatclient.service.session;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.model.Conversation;
import org.chatclient.service.fetch.ConversationFetcher;
import org.chatclient.service.fetch.MessageFetcher;
import org.chatclient.service.fetch.UserDirectory;
import org.chatclient.service.loop.KeyedTimers;
import org.chatclient.service.read.MarkReadScheduler;
import org.chatclient.service.realtime.ConversationEventReconciler;
import org.chatclient.service.realtime.PresenceTracker;
import org.chatclient.service.realtime.PushEventRouter;
import org.chatclient.service.selection.SelectionService;
import org.chatclient.service.send.MessageDraft;
import org.chatclient.service.send.OptimisticSendPipeline;
import org.chatclient.service.store.ChatState;
import org.chatclient.service.store.ConversationStore;

import java.util.List;
import java.util.function.Consumer;

/**
 * Tout ce qui vit le temps d'une session authentifiée : store, minuteurs, chargements,
 * temps réel, envoi et sélection. Construite par {@link ChatSessionManager}.
 */
@Slf4j
@Getter
public class ChatSession {

    private final String userId;
    private final String username;
    private final ConversationStore store;
    private final KeyedTimers timers;
    private final ConversationFetcher conversationFetcher;
    private final MessageFetcher messageFetcher;
    private final UserDirectory userDirectory;
    private final PresenceTracker presence;
    private final MarkReadScheduler markReadScheduler;
    private final ConversationEventReconciler reconciler;
    private final PushEventRouter router;
    private final OptimisticSendPipeline sendPipeline;
    private final SelectionService selection;
    private final MessageDraft draft = new MessageDraft();

    private final Consumer<ChatState> hydrationCheck;

    ChatSession(String userId, String username, ConversationStore store, KeyedTimers timers,
                ConversationFetcher conversationFetcher, MessageFetcher messageFetcher,
                UserDirectory userDirectory, PresenceTracker presence, MarkReadScheduler markReadScheduler,
                ConversationEventReconciler reconciler, PushEventRouter router,
                OptimisticSendPipeline sendPipeline, SelectionService selection) {
        this.userId = userId;
        this.username = username;
        this.store = store;
        this.timers = timers;
        this.conversationFetcher = conversationFetcher;
        this.messageFetcher = messageFetcher;
        this.userDirectory = userDirectory;
        this.presence = presence;
        this.markReadScheduler = markReadScheduler;
        this.reconciler = reconciler;
        this.router = router;
        this.sendPipeline = sendPipeline;
        this.selection = selection;
        this.hydrationCheck = state -> checkHydration(state.getConversations());
    }

    /** Chargements initiaux : conversations, annuaire, profil. */
    void start() {
        store.addListener(hydrationCheck);
        conversationFetcher.fetchConversations();
        userDirectory.fetchUsers();
        userDirectory.fetchCurrentUser();
        log.info("Session ouverte pour {}", username);
    }

    /** Plus aucun minuteur ne part, le store repart à vide. */
    void close() {
        timers.shutdown();
        store.reset();
        log.info("Session fermée pour {}", username);
    }

    private void checkHydration(List<Conversation> conversations) {
        conversationFetcher.checkHydration(conversations);
    }
}
