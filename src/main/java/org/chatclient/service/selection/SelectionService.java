package org.chatclient.service.selection;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;
import org.chatclient.model.User;
import org.chatclient.service.fetch.FetchResult;
import org.chatclient.service.fetch.MessageFetcher;
import org.chatclient.service.fetch.UserDirectory;
import org.chatclient.service.read.MarkReadScheduler;
import org.chatclient.service.store.ChatState;
import org.chatclient.service.store.ConversationLists;
import org.chatclient.service.store.ConversationStore;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** Sélection de la conversation ouverte, recherche et mise en page. */
@Slf4j
public class SelectionService {

    private final ConversationStore store;
    private final MessageFetcher messages;
    private final MarkReadScheduler markRead;
    private final UserDirectory users;
    private final String currentUserId;
    private final Clock clock;
    private final int maxResults;
    private final int mobileBreakpointPx;

    public SelectionService(ConversationStore store, MessageFetcher messages, MarkReadScheduler markRead,
                            UserDirectory users, String currentUserId, Clock clock,
                            int maxResults, int mobileBreakpointPx) {
        this.store = store;
        this.messages = messages;
        this.markRead = markRead;
        this.users = users;
        this.currentUserId = currentUserId;
        this.clock = clock;
        this.maxResults = maxResults;
        this.mobileBreakpointPx = mobileBreakpointPx;
    }

    /**
     * Ouvre une conversation : messages vidés, compteur remis à zéro localement,
     * accusé de lecture programmé s'il y avait des non-lus, puis chargement de l'historique.
     */
    public CompletableFuture<FetchResult<List<Message>>> selectConversation(Conversation conversation) {
        if (conversation == null || conversation.getId() == null) {
            clearSelection();
            return CompletableFuture.completedFuture(FetchResult.ok(List.of()));
        }
        String id = conversation.getId();
        Conversation live = ConversationLists.find(store.getConversations(), id).orElse(conversation);
        boolean hadUnread = live.getUnreadCount() > 0;

        store.update(s -> {
            Conversation current = ConversationLists.find(s.getConversations(), id).orElse(conversation);
            return ConversationLists.withSelectedRead(s
                    .withSelectedConversation(current.withUnreadCount(0))
                    .withMessages(List.of()));
        });
        if (hadUnread) markRead.schedule(id);
        return messages.loadSelected();
    }

    /**
     * Démarre une discussion avec {@code user} : conversation existante si elle existe,
     * sinon conversation temporaire qui sera remplacée à la création côté serveur.
     */
    public CompletableFuture<FetchResult<List<Message>>> selectUser(User user) {
        if (user == null || user.getId() == null) {
            return CompletableFuture.completedFuture(FetchResult.ok(List.of()));
        }
        Optional<Conversation> existing = store.getConversations().stream()
                .filter(c -> !c.isTemporary() && c.hasParticipant(user.getId()))
                .findFirst();
        if (existing.isPresent()) return selectConversation(existing.get());

        Conversation temporary = Conversation.temporary(user, clock.millis());
        store.update(s -> {
            User target = ConversationLists.temporaryTarget(s);
            // déjà ouverte : on garde les messages envoyés entre-temps
            if (target != null && Objects.equals(target.getId(), user.getId())) return s;
            return s.withSelectedConversation(temporary).withMessages(List.of());
        });
        log.debug("Conversation temporaire ouverte avec {}", user.getId());
        return CompletableFuture.completedFuture(FetchResult.ok(List.of()));
    }

    public void clearSelection() {
        store.update(s -> s.withSelectedConversation(null).withMessages(List.of()));
    }

    /** Destinataire des messages de la conversation ouverte, ou null. */
    public User receiver() {
        Conversation selected = store.getSelectedConversation();
        return selected != null ? selected.otherParticipant(currentUserId) : null;
    }

    public FilterResult search(String term) {
        ChatState s = store.snapshot();
        return ConversationFilter.filter(term, s.getConversations(), users.getUsers(), currentUserId,
                s.getSelectedConversation(), maxResults);
    }

    public void onViewportResized(int widthPx) {
        store.setIsMobile(widthPx < mobileBreakpointPx);
    }
}
