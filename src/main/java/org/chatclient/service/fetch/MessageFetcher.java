package org.chatclient.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.exception.ChatApiException;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.ingress.MessageMapper;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.store.ChatState;
import org.chatclient.service.store.ConversationStore;
import org.chatclient.service.store.MessageLists;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Slf4j
public class MessageFetcher {

    static final String LOAD_FAILED = "Impossible de charger les messages";

    private final ChatApiClient api;
    private final ConversationStore store;
    private final EventLoop loop;
    private final NotificationCenter notifier;
    private final AuthFailureHandler authFailure;
    private final String currentUserId;

    public MessageFetcher(ChatApiClient api, ConversationStore store, EventLoop loop,
                          NotificationCenter notifier, AuthFailureHandler authFailure, String currentUserId) {
        this.api = api;
        this.store = store;
        this.loop = loop;
        this.notifier = notifier;
        this.authFailure = authFailure;
        this.currentUserId = currentUserId;
    }

    /**
     * Historique d'une conversation. Conversation absente ou temporaire : liste vide sans appel réseau.
     * Un 404 veut dire "pas encore de conversation" : liste vide, pas une erreur.
     */
    public CompletableFuture<List<Message>> fetchMessages(Conversation conversation) {
        if (conversation == null || conversation.getId() == null || conversation.isTemporary()) {
            return CompletableFuture.completedFuture(List.of());
        }
        User receiver = conversation.otherParticipant(currentUserId);
        if (receiver == null || receiver.getId() == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return loop.call(() -> api.getMessages(receiver.getId()))
                .thenApply(records -> MessageMapper.fromRecords(records, currentUserId))
                .exceptionally(e -> {
                    Throwable cause = EventLoop.unwrap(e);
                    if (cause instanceof ChatApiException apiError && apiError.isNotFound()) {
                        return List.of();
                    }
                    throw new CompletionException(cause);
                });
    }

    /**
     * Charge l'historique de la conversation sélectionnée. Si la sélection a changé
     * pendant l'appel, le résultat est jeté.
     */
    public CompletableFuture<FetchResult<List<Message>>> loadSelected() {
        Conversation selected = store.getSelectedConversation();
        if (selected == null || selected.isTemporary()) {
            return CompletableFuture.completedFuture(FetchResult.ok(List.of()));
        }
        String requestedId = selected.getId();
        return fetchMessages(selected)
                .thenApply(fetched -> {
                    ChatState after = store.update(s -> Objects.equals(s.selectedId(), requestedId)
                            ? s.withMessages(mergeFetched(fetched, s.getMessages()))
                            : s);
                    if (!Objects.equals(after.selectedId(), requestedId)) {
                        log.debug("Historique de {} ignoré : sélection changée", requestedId);
                    }
                    return FetchResult.ok(fetched);
                })
                .exceptionally(e -> FetchFailures.handle(e, LOAD_FAILED, authFailure, notifier));
    }

    // ce qui est arrivé pendant l'appel (push, envoi en attente) est conservé
    static List<Message> mergeFetched(List<Message> fetched, List<Message> live) {
        List<Message> out = new ArrayList<>(fetched);
        for (Message m : live) {
            out = MessageLists.append(out, m);
        }
        return out;
    }
}
