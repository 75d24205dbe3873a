package org.chatclient.service.notify;

public interface SoundPlayer {
    void play();
}
