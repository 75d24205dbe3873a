package org.chatclient;

import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthService;
import org.chatclient.service.realtime.StompPushChannel;
import org.chatclient.service.session.ChatSessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(properties = {
        // aucune session enregistrée : pas de reprise au démarrage
        "chat.session.file=target/test-session/absent.json",
        "chat.api.base-url=http://localhost:59999",
        "chat.ws.url=ws://localhost:59999/ws"
})
class ChatClientContextTest {

    @Autowired
    private ChatSessionManager sessions;

    @Autowired
    private AuthService authService;

    @Autowired
    private ChatApiClient api;

    @Autowired
    private StompPushChannel channel;

    @Test
    void context_shouldStartWithoutSession() {
        assertThat(api).isNotNull();
        assertThat(authService).isNotNull();
        assertThat(sessions.isActive()).isFalse();
        assertThat(channel.isConnected()).isFalse();
    }
}
