package org.chatclient.service.api;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.dto.*;
import org.chatclient.exception.ChatApiException;
import org.chatclient.exception.SessionExpiredException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.function.Supplier;

/**
 * Frontière REST du client. Toute erreur ressort en {@link ChatApiException},
 * 401/403 en {@link SessionExpiredException}.
 */
@Slf4j
@Service
public class ChatApiClient {

    private static final ParameterizedTypeReference<List<ConversationPayload>> CONVERSATIONS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<UserPayload>> USERS =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ChatApiClient(RestTemplate restTemplate,
                         @Value("${chat.api.base-url:http://localhost:5000}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    // ---- Conversations ----

    public List<ConversationPayload> getConversations() {
        // paramètre t + no-cache : jamais de liste servie depuis un cache intermédiaire
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/conversations")
                .queryParam("t", System.currentTimeMillis())
                .toUriString();
        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl(CacheControl.noCache());
        List<ConversationPayload> body = call("GET /api/conversations", () ->
                restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), CONVERSATIONS).getBody());
        return body != null ? body : List.of();
    }

    public void markRead(String conversationId) {
        call("POST /api/conversations/{id}/read", () ->
                restTemplate.exchange(baseUrl + "/api/conversations/{id}/read", HttpMethod.POST,
                        jsonEntity(null), Void.class, conversationId));
    }

    // ---- Messages ----

    public List<MessageRecord> getMessages(String receiverId) {
        MessagesResponse body = call("GET /api/messages/{receiverId}", () ->
                restTemplate.getForObject(baseUrl + "/api/messages/{receiverId}", MessagesResponse.class, receiverId));
        if (body == null || body.getData() == null) return List.of();
        return body.getData();
    }

    public MessageRecord sendMessage(String receiverId, String text) {
        SendMessageResponse body = call("POST /api/messages/send/{receiverId}", () ->
                restTemplate.postForObject(baseUrl + "/api/messages/send/{receiverId}",
                        jsonEntity(new SendMessageRequest(text)), SendMessageResponse.class, receiverId));
        if (body == null || body.getData() == null || body.getData().getId() == null) {
            throw new ChatApiException(200, "Réponse d'envoi sans message");
        }
        return body.getData();
    }

    // ---- Utilisateurs ----

    public List<UserPayload> getUsers() {
        List<UserPayload> body = call("GET /api/users", () ->
                restTemplate.exchange(baseUrl + "/api/users", HttpMethod.GET, null, USERS).getBody());
        return body != null ? body : List.of();
    }

    public UserPayload getCurrentUser() {
        return call("GET /api/users/me", () ->
                restTemplate.getForObject(baseUrl + "/api/users/me", UserPayload.class));
    }

    // ---- Auth ----

    public AuthResponse login(AuthRequest request) {
        return call("POST /api/auth/login", () ->
                restTemplate.postForObject(baseUrl + "/api/auth/login", jsonEntity(request), AuthResponse.class));
    }

    public AuthResponse signup(SignupRequest request) {
        return call("POST /api/auth/signup", () ->
                restTemplate.postForObject(baseUrl + "/api/auth/signup", jsonEntity(request), AuthResponse.class));
    }

    public void logout() {
        call("POST /api/auth/logout", () ->
                restTemplate.exchange(baseUrl + "/api/auth/logout", HttpMethod.POST, jsonEntity(null), Void.class));
    }

    // ---- Utils ----

    private HttpEntity<Object> jsonEntity(Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private <T> T call(String endpoint, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new SessionExpiredException(status);
            }
            log.warn("{} a échoué : HTTP {}", endpoint, status);
            throw new ChatApiException(status, endpoint + " : HTTP " + status, e);
        } catch (ResourceAccessException e) {
            log.warn("{} injoignable : {}", endpoint, e.getMessage());
            throw new ChatApiException(0, endpoint + " : serveur injoignable", e);
        } catch (RestClientException e) {
            log.warn("{} : réponse illisible ({})", endpoint, e.getMessage());
            throw new ChatApiException(0, endpoint + " : réponse illisible", e);
        }
    }
}
