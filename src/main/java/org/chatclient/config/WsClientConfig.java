package org.chatclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

@Configuration
public class WsClientConfig {

    @Bean
    public WebSocketStompClient stompClient(ObjectMapper objectMapper) {
        WebSocketStompClient client = new WebSocketStompClient(new StandardWebSocketClient());

        // enveloppes JSON, parfois servies en text/plain
        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter(
                MimeTypeUtils.APPLICATION_JSON, MimeTypeUtils.TEXT_PLAIN);
        converter.setObjectMapper(objectMapper);
        client.setMessageConverter(converter);

        client.setInboundMessageSizeLimit(64 * 1024);
        client.setTaskScheduler(heartbeatScheduler());
        client.setDefaultHeartbeat(new long[]{10_000, 10_000});
        return client;
    }

    private ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(1);
        ts.setThreadNamePrefix("ws-heartbeat-");
        ts.setDaemon(true);
        ts.initialize();
        return ts;
    }
}
