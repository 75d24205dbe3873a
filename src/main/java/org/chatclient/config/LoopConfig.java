package org.chatclient.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Un seul thread "chat-loop" exécute handlers push, timers et suites des appels réseau :
 * deux mutations du store ne tournent jamais en parallèle.
 * Les appels HTTP bloquants partent sur "chat-io".
 */
@Configuration
public class LoopConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService chatLoop() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("chat-loop-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService chatIo() {
        return Executors.newFixedThreadPool(4, new CustomizableThreadFactory("chat-io-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
