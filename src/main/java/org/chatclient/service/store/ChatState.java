package org.chatclient.service.store;

import lombok.Value;
import lombok.With;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;

import java.util.List;

/** Instantané immuable de l'état client. */
@Value
@With
public class ChatState {
    public static final ChatState EMPTY = new ChatState(null, List.of(), List.of(), false);

    Conversation selectedConversation;
    List<Conversation> conversations;
    List<Message> messages;           // messages de la conversation sélectionnée
    boolean mobile;

    public ChatState(Conversation selectedConversation, List<Conversation> conversations,
                     List<Message> messages, boolean mobile) {
        this.selectedConversation = selectedConversation;
        this.conversations = conversations != null ? List.copyOf(conversations) : List.of();
        this.messages = messages != null ? List.copyOf(messages) : List.of();
        this.mobile = mobile;
    }

    public String selectedId() {
        return selectedConversation != null ? selectedConversation.getId() : null;
    }

    public boolean isSelected(String conversationId) {
        return conversationId != null && conversationId.equals(selectedId());
    }
}
