package org.chatclient.service.send;

/** Zone de saisie du message en cours. */
public class MessageDraft {
    private volatile String text = "";

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text != null ? text : "";
    }

    public void clear() {
        text = "";
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
