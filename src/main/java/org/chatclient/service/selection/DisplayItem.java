package org.chatclient.service.selection;

import lombok.Value;
import org.chatclient.model.Conversation;
import org.chatclient.model.User;

/** Une ligne de la barre latérale : conversation existante ou utilisateur à contacter. */
@Value
public class DisplayItem {

    public enum Type { CONVERSATION, USER }

    Type type;
    Conversation conversation;
    User user;
    boolean selected;

    public static DisplayItem of(Conversation conversation, boolean selected) {
        return new DisplayItem(Type.CONVERSATION, conversation, null, selected);
    }

    public static DisplayItem of(User user, boolean selected) {
        return new DisplayItem(Type.USER, null, user, selected);
    }
}
