package org.chatclient.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.chatclient.config.RestClientConfig;
import org.chatclient.config.SessionCookieInterceptor;
import org.chatclient.dto.AuthRequest;
import org.chatclient.dto.ConversationPayload;
import org.chatclient.dto.MessageRecord;
import org.chatclient.exception.ChatApiException;
import org.chatclient.exception.SessionExpiredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class ChatApiClientTest {

    private static final String BASE = "http://chat.test";

    private MockRestServiceServer server;
    private ChatApiClient client;

    @BeforeEach
    void init() {
        RestTemplate restTemplate = new RestClientConfig()
                .restTemplate(new ObjectMapper(), new SessionCookieInterceptor());
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ChatApiClient(restTemplate, BASE + "/");
    }

    @Test
    void getConversations_shouldBypassCacheWithTimestampParam() {
        server.expect(requestTo(startsWith(BASE + "/api/conversations?t=")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Cache-Control", "no-cache"))
                .andRespond(withSuccess("[{\"_id\":\"c1\",\"participants\":[\"u2\"],\"unreadCount\":2}]",
                        MediaType.APPLICATION_JSON));

        List<ConversationPayload> out = client.getConversations();

        assertThat(out).hasSize(1);
        assertThat(out.get(0).getId()).isEqualTo("c1");
        assertThat(out.get(0).getUnreadCount().asInt()).isEqualTo(2);
        server.verify();
    }

    @Test
    void getMessages_shouldReadDataField() {
        server.expect(requestTo(BASE + "/api/messages/u2"))
                .andRespond(withSuccess("{\"data\":[{\"_id\":\"m1\",\"message\":\"salut\","
                        + "\"createdAt\":\"2024-05-01T10:00:00Z\",\"senderId\":\"u2\"}]}", MediaType.APPLICATION_JSON));

        List<MessageRecord> out = client.getMessages("u2");

        assertThat(out).extracting(MessageRecord::getMessage).containsExactly("salut");
    }

    @Test
    void getMessages_shouldThrowNotFoundOn404() {
        server.expect(requestTo(BASE + "/api/messages/u9")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.getMessages("u9"))
                .isInstanceOf(ChatApiException.class)
                .matches(e -> ((ChatApiException) e).isNotFound());
    }

    @Test
    void sendMessage_shouldPostBodyAndReadConfirmation() {
        server.expect(requestTo(BASE + "/api/messages/send/u2"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.message").value("salut"))
                .andRespond(withSuccess("{\"data\":{\"_id\":\"m1\",\"message\":\"salut\","
                        + "\"createdAt\":\"2024-05-01T10:00:00Z\"}}", MediaType.APPLICATION_JSON));

        MessageRecord sent = client.sendMessage("u2", "salut");

        assertThat(sent.getId()).isEqualTo("m1");
        server.verify();
    }

    @Test
    void sendMessage_shouldFailWhenResponseHasNoData() {
        server.expect(requestTo(BASE + "/api/messages/send/u2"))
                .andRespond(withSuccess("{\"message\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.sendMessage("u2", "salut")).isInstanceOf(ChatApiException.class);
    }

    @Test
    void markRead_shouldThrowSessionExpiredOn401() {
        server.expect(requestTo(BASE + "/api/conversations/c1/read"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.markRead("c1")).isInstanceOf(SessionExpiredException.class);
    }

    @Test
    void getUsers_shouldKeepStatusOnServerError() {
        server.expect(requestTo(BASE + "/api/users")).andRespond(withServerError());

        assertThatThrownBy(() -> client.getUsers())
                .isInstanceOf(ChatApiException.class)
                .isNotInstanceOf(SessionExpiredException.class)
                .extracting(e -> ((ChatApiException) e).getStatus())
                .isEqualTo(500);
    }

    @Test
    void sessionCookie_shouldBeReplayedOnNextCalls() {
        server.expect(requestTo(BASE + "/api/auth/login"))
                .andRespond(withSuccess("{\"user\":{\"_id\":\"u1\",\"username\":\"moi\"}}", MediaType.APPLICATION_JSON)
                        .header("Set-Cookie", "jwt=abc123; Path=/; HttpOnly"));
        server.expect(requestTo(BASE + "/api/users/me"))
                .andExpect(header("Cookie", "jwt=abc123"))
                .andRespond(withSuccess("{\"_id\":\"u1\",\"fullName\":\"Moi\"}", MediaType.APPLICATION_JSON));

        client.login(new AuthRequest("moi", "secret"));
        assertThat(client.getCurrentUser().getFullName()).isEqualTo("Moi");
        server.verify();
    }
}
