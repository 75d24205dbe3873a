package org.chatclient.service.send;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.exception.SessionExpiredException;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.fetch.ConversationFetcher;
import org.chatclient.service.ingress.MessageMapper;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.store.ChatState;
import org.chatclient.service.store.ConversationLists;
import org.chatclient.service.store.ConversationStore;
import org.chatclient.service.store.MessageLists;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Envoi optimiste en deux temps : le message apparaît tout de suite sous un id local
 * "pending_...", puis la réponse du serveur le confirme à la même place ou le retire.
 * La liste des conversations est rechargée après chaque envoi, réussi ou non.
 */
@Slf4j
public class OptimisticSendPipeline {

    static final String PENDING_PREFIX = "pending_";
    static final String SEND_FAILED = "Échec de l'envoi du message";

    private final ChatApiClient api;
    private final ConversationStore store;
    private final EventLoop loop;
    private final NotificationCenter notifier;
    private final AuthFailureHandler authFailure;
    private final ConversationFetcher conversations;
    private final String currentUserId;
    private final Clock clock;

    public OptimisticSendPipeline(ChatApiClient api, ConversationStore store, EventLoop loop,
                                  NotificationCenter notifier, AuthFailureHandler authFailure,
                                  ConversationFetcher conversations, String currentUserId, Clock clock) {
        this.api = api;
        this.store = store;
        this.loop = loop;
        this.notifier = notifier;
        this.authFailure = authFailure;
        this.conversations = conversations;
        this.currentUserId = currentUserId;
        this.clock = clock;
    }

    /**
     * Envoie le contenu de la zone de saisie vers la conversation sélectionnée.
     * La saisie n'est vidée qu'une fois l'envoi accepté ; un refus la laisse intacte.
     */
    public CompletableFuture<SendResult> submit(MessageDraft draft) {
        String text = draft.getText();
        if (text.isBlank()) return CompletableFuture.completedFuture(SendResult.REJECTED);
        // le contenu est perdu en cas d'échec réseau, pas de nouvelle tentative
        return send(store.snapshot().selectedId(), text, draft::clear);
    }

    public CompletableFuture<SendResult> send(String conversationId, String text) {
        return send(conversationId, text, () -> { });
    }

    private CompletableFuture<SendResult> send(String conversationId, String text, Runnable onAccepted) {
        String content = text != null ? text.trim() : "";
        String receiverId = resolveReceiver(conversationId);
        if (content.isEmpty() || receiverId == null) {
            log.debug("Envoi refusé : message vide ou destinataire inconnu");
            return CompletableFuture.completedFuture(SendResult.REJECTED);
        }

        String pendingId = PENDING_PREFIX + UUID.randomUUID();
        Message pending = Message.builder()
                .id(pendingId)
                .content(content)
                .timestamp(Instant.now(clock).toString())
                .sentByCurrentUser(true)
                .pending(true)
                .build();
        store.update(s -> s.isSelected(conversationId)
                ? s.withMessages(MessageLists.append(s.getMessages(), pending))
                : s);
        onAccepted.run();

        return loop.call(() -> api.sendMessage(receiverId, content))
                .handle((record, error) -> {
                    SendResult outcome = error == null
                            ? confirm(pendingId, receiverId, record == null ? null
                                    : MessageMapper.fromRecord(record, currentUserId))
                            : rollback(pendingId, EventLoop.unwrap(error));
                    // l'aperçu et l'ordre de la barre latérale viennent du serveur
                    conversations.fetchConversations();
                    return outcome;
                });
    }

    private SendResult confirm(String pendingId, String receiverId, Message confirmed) {
        if (confirmed == null) return rollback(pendingId, new IllegalStateException("réponse vide"));
        Message sent = confirmed.toBuilder().sentByCurrentUser(true).pending(false).build();
        store.update(s -> s.withMessages(MessageLists.promote(s.getMessages(), pendingId, sent,
                isSelectedReceiver(s, receiverId))));
        return SendResult.SENT;
    }

    private SendResult rollback(String pendingId, Throwable cause) {
        store.updateMessages(list -> MessageLists.remove(list, pendingId));
        if (cause instanceof SessionExpiredException) {
            authFailure.onSessionExpired();
            return SendResult.SESSION_EXPIRED;
        }
        log.warn("Envoi du message en échec : {}", cause.getMessage());
        notifier.error(SEND_FAILED);
        return SendResult.FAILED;
    }

    private String resolveReceiver(String conversationId) {
        if (conversationId == null) return null;
        ChatState s = store.snapshot();
        Conversation conversation = s.isSelected(conversationId)
                ? s.getSelectedConversation()
                : ConversationLists.find(s.getConversations(), conversationId).orElse(null);
        if (conversation == null) return null;
        User receiver = conversation.otherParticipant(currentUserId);
        return receiver != null ? receiver.getId() : null;
    }

    private boolean isSelectedReceiver(ChatState s, String receiverId) {
        Conversation selected = s.getSelectedConversation();
        if (selected == null) return false;
        User other = selected.otherParticipant(currentUserId);
        return other != null && Objects.equals(other.getId(), receiverId);
    }
}
