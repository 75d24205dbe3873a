package org.chatclient.service.loop;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Boucle d'événements coopérative : les appels bloquants partent sur {@code io},
 * leur résultat revient sur {@code loop}. Toute suite enchaînée sur le futur
 * retourné s'exécute donc sur la boucle et doit relire l'état courant du store.
 */
public class EventLoop {

    private final Executor io;
    private final Executor loop;

    public EventLoop(Executor io, Executor loop) {
        this.io = io;
        this.loop = loop;
    }

    /** Boucle synchrone, pour les tests. */
    public static EventLoop direct() {
        Executor now = Runnable::run;
        return new EventLoop(now, now);
    }

    public <T> CompletableFuture<T> call(Supplier<T> blocking) {
        return CompletableFuture.supplyAsync(blocking, io)
                .whenCompleteAsync((value, error) -> { }, loop);
    }

    public CompletableFuture<Void> run(Runnable blocking) {
        return call(() -> {
            blocking.run();
            return null;
        });
    }

    public void post(Runnable task) {
        loop.execute(task);
    }

    /** Retire l'enveloppe CompletionException posée par CompletableFuture. */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
