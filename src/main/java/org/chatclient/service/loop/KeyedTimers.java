package org.chatclient.service.loop;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Minuteurs nommés : reprogrammer une clé annule le minuteur en attente (debounce).
 * Après {@link #shutdown()} plus rien ne part, même un minuteur déjà échu.
 */
@Slf4j
public class KeyedTimers {
    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public KeyedTimers(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void schedule(String key, long delayMs, Runnable task) {
        if (closed) return;
        cancel(key);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            tasks.remove(key, self.get());
            if (closed) return;
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Minuteur {} en échec", key, e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        self.set(future);
        tasks.put(key, future);
    }

    public void cancel(String key) {
        ScheduledFuture<?> f = tasks.remove(key);
        if (f != null) f.cancel(false);
    }

    public void cancelAllOf(String prefix) {
        tasks.keySet().removeIf(k -> {
            if (k.startsWith(prefix)) {
                ScheduledFuture<?> f = tasks.get(k);
                if (f != null) f.cancel(false);
                return true;
            }
            return false;
        });
    }

    public boolean isPending(String key) {
        return tasks.containsKey(key);
    }

    public int pendingCount() {
        return tasks.size();
    }

    /** Fin de session : annule tout et refuse les nouvelles programmations. */
    public void shutdown() {
        closed = true;
        tasks.values().forEach(f -> f.cancel(false));
        tasks.clear();
        log.debug("Minuteurs de session annulés");
    }
}
