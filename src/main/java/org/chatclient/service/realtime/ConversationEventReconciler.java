package org.chatclient.service.realtime;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.dto.ConversationPayload;
import org.chatclient.dto.NewMessageEvent;
import org.chatclient.dto.PushMessage;
import org.chatclient.model.Conversation;
import org.chatclient.model.LastMessage;
import org.chatclient.model.Message;
import org.chatclient.model.User;
import org.chatclient.service.ingress.ConversationNormalizer;
import org.chatclient.service.ingress.MessageMapper;
import org.chatclient.service.loop.KeyedTimers;
import org.chatclient.service.notify.NotificationSound;
import org.chatclient.service.read.MarkReadScheduler;
import org.chatclient.service.store.ChatState;
import org.chatclient.service.store.ConversationLists;
import org.chatclient.service.store.ConversationStore;
import org.chatclient.service.store.MessageLists;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Fusionne les événements temps réel dans le store.
 * <p>
 * Chaque transition lit la sélection, les messages et les conversations au moment du
 * commit ({@link ConversationStore#update}), jamais une valeur capturée avant. Les effets
 * de bord (minuteurs, son, accusé de lecture) partent après le commit, selon son issue.
 * <p>
 * message:new et conversation:updated commutent : un message déjà résumé par un patch
 * (lastMessage au moins aussi récent) ne touche plus ni l'aperçu ni le compteur.
 */
@Slf4j
public class ConversationEventReconciler {

    static final String FRESH_PREFIX = "fresh:";

    private enum Outcome { OPEN_APPENDED, OPEN_DUPLICATE, SIDEBAR }

    private final ConversationStore store;
    private final String currentUserId;
    private final MarkReadScheduler markRead;
    private final KeyedTimers timers;
    private final NotificationSound sound;
    private final long freshDelayMs;

    public ConversationEventReconciler(ConversationStore store, String currentUserId, MarkReadScheduler markRead,
                                       KeyedTimers timers, NotificationSound sound,
                                       long freshDelayMs) {
        this.store = store;
        this.currentUserId = currentUserId;
        this.markRead = markRead;
        this.timers = timers;
        this.sound = sound;
        this.freshDelayMs = freshDelayMs;
    }

    // ------------------------------------------------------------------
    // message:new
    // ------------------------------------------------------------------
    public void onMessageNew(NewMessageEvent event) {
        if (event == null || event.getConversationId() == null
                || event.getMessage() == null || event.getMessage().getId() == null) {
            log.warn("message:new incomplet ignoré");
            return;
        }
        String conversationId = event.getConversationId();
        PushMessage pushed = event.getMessage();
        boolean incoming = !Objects.equals(pushed.getSenderId(), currentUserId);
        Message message = MessageMapper.fromPush(pushed, currentUserId).withFresh(true);

        AtomicReference<Outcome> outcome = new AtomicReference<>();
        store.update(s -> {
            if (s.isSelected(conversationId)) {
                List<Message> merged = MessageLists.mergeIncoming(s.getMessages(), message);
                outcome.set(merged == s.getMessages() ? Outcome.OPEN_DUPLICATE : Outcome.OPEN_APPENDED);
                return s.withMessages(merged);
            }
            outcome.set(Outcome.SIDEBAR);
            return s.withConversations(ConversationLists.patch(s.getConversations(), conversationId,
                    c -> applyNewMessage(c, pushed, incoming)));
        });

        switch (outcome.get()) {
            case OPEN_APPENDED -> {
                String id = message.getId();
                timers.schedule(FRESH_PREFIX + id, freshDelayMs,
                        () -> store.updateMessages(list -> MessageLists.clearFresh(list, id)));
                // conversation ouverte : aucun non-lu ne doit s'accumuler
                if (incoming && !Conversation.isTemporaryId(conversationId)) markRead.schedule(conversationId);
            }
            case SIDEBAR -> {
                if (incoming) sound.play();
            }
            case OPEN_DUPLICATE -> log.debug("message:new {} déjà présent", message.getId());
        }
    }

    static Conversation applyNewMessage(Conversation c, PushMessage m, boolean incoming) {
        if (alreadySummarized(c.getLastMessage(), m.getCreatedAt())) return c;
        Conversation out = c.withLastMessage(new LastMessage(m.getContent(), m.getCreatedAt(), m.getSenderId()));
        // incrément provisoire, le patch conversation:updated fait foi
        return incoming ? out.withUnreadCount(c.getUnreadCount() + 1) : out;
    }

    static boolean alreadySummarized(LastMessage last, String createdAt) {
        if (last == null || last.getCreatedAt() == null || createdAt == null) return false;
        try {
            return !Instant.parse(last.getCreatedAt()).isBefore(Instant.parse(createdAt));
        } catch (DateTimeParseException e) {
            return last.getCreatedAt().equals(createdAt);
        }
    }

    // ------------------------------------------------------------------
    // conversation:updated
    // ------------------------------------------------------------------
    public void onConversationUpdated(ConversationPayload patch) {
        if (patch == null || patch.getId() == null) {
            log.warn("conversation:updated sans id ignoré");
            return;
        }
        String id = patch.getId();
        LastMessage lastMessage = ConversationNormalizer.lastMessage(patch.getLastMessage());
        boolean hasCount = ConversationNormalizer.hasUnreadCount(patch.getUnreadCount());
        int count = Math.max(0, ConversationNormalizer.unreadCount(patch.getUnreadCount(), 0));

        store.update(s -> {
            if (!ConversationLists.contains(s.getConversations(), id)) return s;
            boolean selected = s.isSelected(id);
            UnaryOperator<Conversation> apply = c -> {
                Conversation out = lastMessage != null ? c.withLastMessage(lastMessage) : c;
                // sélectionnée = lue, quel que soit le compteur du serveur
                return hasCount ? out.withUnreadCount(selected ? 0 : count) : out;
            };
            ChatState next = s.withConversations(ConversationLists.patch(s.getConversations(), id, apply));
            return selected ? next.withSelectedConversation(apply.apply(s.getSelectedConversation())) : next;
        });
    }

    // ------------------------------------------------------------------
    // conversation:created
    // ------------------------------------------------------------------
    public void onConversationCreated(ConversationPayload payload) {
        if (payload == null || payload.getId() == null) {
            log.warn("conversation:created sans id ignoré");
            return;
        }
        Conversation created = ConversationNormalizer.toConversation(payload);
        AtomicBoolean substituted = new AtomicBoolean();

        store.update(s -> {
            substituted.set(false);
            if (ConversationLists.contains(s.getConversations(), created.getId())) return s;

            ChatState next = s;
            User target = ConversationLists.temporaryTarget(s);
            if (target != null && created.hasParticipant(target.getId())) {
                next = ConversationLists.adoptForTemporary(s, created);
                substituted.set(true);
            }
            Conversation added = substituted.get() ? next.getSelectedConversation() : created;
            return next.withConversations(ConversationLists.append(s.getConversations(), added));
        });

        if (substituted.get()) {
            log.info("Conversation temporaire remplacée par {}", created.getId());
        }
    }
}
