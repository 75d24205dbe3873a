package org.chatclient.service.store;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Conteneur d'état d'une session : conversation sélectionnée, liste des conversations,
 * messages de la conversation ouverte, indicateur mobile.
 * <p>
 * Les setters remplacent une tranche entière. Toute fusion passe par
 * {@link #update(UnaryOperator)}, évaluée contre l'état le plus récent au moment du commit.
 * Les getters relisent toujours le dernier état committé.
 */
@Slf4j
public class ConversationStore {

    private final AtomicReference<ChatState> state = new AtomicReference<>(ChatState.EMPTY);
    private final List<Consumer<ChatState>> listeners = new CopyOnWriteArrayList<>();

    public ChatState snapshot() {
        return state.get();
    }

    public Conversation getSelectedConversation() { return state.get().getSelectedConversation(); }
    public List<Conversation> getConversations() { return state.get().getConversations(); }
    public List<Message> getMessages() { return state.get().getMessages(); }
    public boolean isMobile() { return state.get().isMobile(); }

    public void setSelectedConversation(Conversation conversation) {
        update(s -> s.withSelectedConversation(conversation));
    }

    public void setConversations(List<Conversation> conversations) {
        update(s -> s.withConversations(List.copyOf(conversations)));
    }

    public void setMessages(List<Message> messages) {
        update(s -> s.withMessages(List.copyOf(messages)));
    }

    public void setIsMobile(boolean mobile) {
        update(s -> s.withMobile(mobile));
    }

    public ChatState update(UnaryOperator<ChatState> transition) {
        ChatState previous;
        ChatState next;
        do {
            previous = state.get();
            next = Objects.requireNonNull(transition.apply(previous), "transition sans état");
        } while (!state.compareAndSet(previous, next));
        if (next != previous) notifyListeners(next);
        return next;
    }

    public ChatState updateConversations(UnaryOperator<List<Conversation>> transition) {
        return update(s -> s.withConversations(transition.apply(s.getConversations())));
    }

    public ChatState updateMessages(UnaryOperator<List<Message>> transition) {
        return update(s -> s.withMessages(transition.apply(s.getMessages())));
    }

    public void addListener(Consumer<ChatState> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ChatState> listener) {
        listeners.remove(listener);
    }

    /** Fin de session : on repart d'un état vide, sans prévenir personne. */
    public void reset() {
        listeners.clear();
        state.set(ChatState.EMPTY);
    }

    private void notifyListeners(ChatState next) {
        for (Consumer<ChatState> l : listeners) {
            try {
                l.accept(next);
            } catch (RuntimeException e) {
                log.error("Listener du store en échec", e);
            }
        }
    }
}
