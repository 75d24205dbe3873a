package org.chatclient.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Notifications visibles par l'utilisateur (toasts), fermables une par une. */
@Slf4j
@Component
public class NotificationCenter {

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final List<Notification> active = new CopyOnWriteArrayList<>();

    public NotificationCenter(Clock clock) {
        this.clock = clock;
    }

    public long error(String message) {
        log.warn("[toast] {}", message);
        return push(Notification.Level.ERROR, message);
    }

    public long success(String message) {
        log.info("[toast] {}", message);
        return push(Notification.Level.SUCCESS, message);
    }

    public long info(String message) {
        log.info("[toast] {}", message);
        return push(Notification.Level.INFO, message);
    }

    public void dismiss(long id) {
        active.removeIf(n -> n.getId() == id);
    }

    public void dismissAll() {
        active.clear();
    }

    public List<Notification> active() {
        return List.copyOf(active);
    }

    private long push(Notification.Level level, String message) {
        long id = ids.incrementAndGet();
        active.add(new Notification(id, level, message, Instant.now(clock)));
        return id;
    }
}
