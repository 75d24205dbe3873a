package org.chatclient.service.notify;

import org.chatclient.config.ChatProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Son de nouveau message, au plus une lecture par intervalle minimal. */
@Component
public class NotificationSound {

    private final SoundPlayer player;
    private final Clock clock;
    private final long minIntervalMs;
    private long lastPlayMs = Long.MIN_VALUE;

    @Autowired
    public NotificationSound(SoundPlayer player, Clock clock, ChatProperties props) {
        this(player, clock, props.getSoundMinIntervalMs());
    }

    public NotificationSound(SoundPlayer player, Clock clock, long minIntervalMs) {
        this.player = player;
        this.clock = clock;
        this.minIntervalMs = minIntervalMs;
    }

    /** @return true si le son a été joué */
    public synchronized boolean play() {
        long now = clock.millis();
        if (lastPlayMs != Long.MIN_VALUE && now - lastPlayMs < minIntervalMs) return false;
        lastPlayMs = now;
        player.play();
        return true;
    }
}
