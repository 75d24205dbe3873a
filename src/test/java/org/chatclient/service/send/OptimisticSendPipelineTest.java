package org.chatclient.service.send;

import org.chatclient.dto.MessageRecord;
import org.chatclient.exception.ChatApiException;
import org.chatclient.exception.SessionExpiredException;
import org.chatclient.model.Conversation;
import org.chatclient.model.Message;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.fetch.ConversationFetcher;
import org.chatclient.service.fetch.FetchResult;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.store.ConversationStore;
import org.chatclient.service.store.MessageLists;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OptimisticSendPipelineTest {

    private static final User ME = User.builder().id("u1").fullName("Moi").build();
    private static final User ALICE = User.builder().id("u2").fullName("Alice").build();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ChatApiClient api;

    @Mock
    private NotificationCenter notifier;

    @Mock
    private AuthFailureHandler authFailure;

    @Mock
    private ConversationFetcher conversations;

    private final List<Runnable> loopQueue = new ArrayList<>();
    private ConversationStore store;
    private OptimisticSendPipeline pipeline;
    private Conversation c1;

    @BeforeEach
    void init() {
        lenient().when(conversations.fetchConversations())
                .thenReturn(CompletableFuture.completedFuture(FetchResult.ok(List.of())));
        store = new ConversationStore();
        c1 = Conversation.builder().id("c1").participant(ME).participant(ALICE).build();
        store.setConversations(List.of(c1));
        store.setSelectedConversation(c1);
        // appels réseau immédiats, retours mis en file sur la boucle
        Executor loop = loopQueue::add;
        pipeline = new OptimisticSendPipeline(api, store, new EventLoop(Runnable::run, loop), notifier,
                authFailure, conversations, "u1", CLOCK);
    }

    private void drainLoop() {
        List<Runnable> tasks = new ArrayList<>(loopQueue);
        loopQueue.clear();
        tasks.forEach(Runnable::run);
    }

    private static MessageRecord confirmed(String id, String text) {
        return new MessageRecord(id, text, "2024-05-01T10:00:01Z", "u1");
    }

    @Test
    void send_shouldShowMessageBeforeServerResponds() {
        when(api.sendMessage("u2", "salut")).thenReturn(confirmed("m1", "salut"));

        CompletableFuture<SendResult> result = pipeline.send("c1", "  salut ");

        assertThat(result).isNotDone();
        assertThat(store.getMessages()).hasSize(1);
        Message pending = store.getMessages().get(0);
        assertThat(pending.isPending()).isTrue();
        assertThat(pending.isSentByCurrentUser()).isTrue();
        assertThat(pending.getContent()).isEqualTo("salut");
        assertThat(pending.getId()).startsWith(OptimisticSendPipeline.PENDING_PREFIX);
    }

    @Test
    void send_shouldReplacePendingEntryOnSuccess() {
        store.setMessages(List.of(Message.builder().id("m0").content("avant")
                .timestamp("2024-05-01T09:00:00Z").build()));
        when(api.sendMessage("u2", "salut")).thenReturn(confirmed("m1", "salut"));

        CompletableFuture<SendResult> result = pipeline.send("c1", "salut");
        drainLoop();

        assertThat(result.join()).isEqualTo(SendResult.SENT);
        assertThat(store.getMessages()).extracting(Message::getId).containsExactly("m0", "m1");
        assertThat(store.getMessages().get(1).isPending()).isFalse();
        verify(conversations).fetchConversations();
    }

    @Test
    void send_shouldKeepSingleMessageWhenEchoArrivesFirst() {
        when(api.sendMessage("u2", "salut")).thenReturn(confirmed("m1", "salut"));

        CompletableFuture<SendResult> result = pipeline.send("c1", "salut");
        // l'écho message:new passe avant la réponse REST
        store.updateMessages(list -> MessageLists.mergeIncoming(list,
                Message.builder().id("m1").content("salut").timestamp("2024-05-01T10:00:01Z")
                        .sentByCurrentUser(true).build()));
        drainLoop();

        assertThat(result.join()).isEqualTo(SendResult.SENT);
        assertThat(store.getMessages()).extracting(Message::getId).containsExactly("m1");
    }

    @Test
    void send_shouldRemovePendingAndNotifyOnFailure() {
        Message earlier = Message.builder().id("m0").content("déjà confirmé")
                .timestamp("2024-05-01T09:00:00Z").sentByCurrentUser(true).build();
        store.setMessages(List.of(earlier));
        when(api.sendMessage("u2", "salut")).thenThrow(new ChatApiException(500, "HTTP 500"));

        CompletableFuture<SendResult> result = pipeline.send("c1", "salut");
        drainLoop();

        assertThat(result.join()).isEqualTo(SendResult.FAILED);
        assertThat(store.getMessages()).containsExactly(earlier);
        verify(notifier).error(OptimisticSendPipeline.SEND_FAILED);
        // la liste est rechargée même après un échec
        verify(conversations).fetchConversations();
    }

    @Test
    void send_shouldNotifyHandlerOnSessionExpired() {
        when(api.sendMessage("u2", "salut")).thenThrow(new SessionExpiredException(401));

        CompletableFuture<SendResult> result = pipeline.send("c1", "salut");
        drainLoop();

        assertThat(result.join()).isEqualTo(SendResult.SESSION_EXPIRED);
        assertThat(store.getMessages()).isEmpty();
        verify(authFailure).onSessionExpired();
        verify(notifier, never()).error(anyString());
    }

    @Test
    void send_shouldRejectEmptyTextOrMissingReceiver() {
        assertThat(pipeline.send("c1", "   ").join()).isEqualTo(SendResult.REJECTED);
        assertThat(pipeline.send("inconnue", "salut").join()).isEqualTo(SendResult.REJECTED);
        assertThat(pipeline.send(null, "salut").join()).isEqualTo(SendResult.REJECTED);

        verifyNoInteractions(api);
        assertThat(store.getMessages()).isEmpty();
    }

    @Test
    void send_shouldTargetUserOfTemporaryConversation() {
        Conversation temp = Conversation.temporary(ALICE, 1L);
        store.setSelectedConversation(temp);
        when(api.sendMessage("u2", "premier")).thenReturn(confirmed("m1", "premier"));

        pipeline.send(temp.getId(), "premier");
        drainLoop();

        verify(api).sendMessage("u2", "premier");
        assertThat(store.getMessages()).extracting(Message::getId).containsExactly("m1");
    }

    @Test
    void submit_shouldClearDraftOnceAccepted() {
        when(api.sendMessage("u2", "salut")).thenReturn(confirmed("m1", "salut"));
        MessageDraft draft = new MessageDraft();
        draft.setText("salut");

        pipeline.submit(draft);

        assertThat(draft.getText()).isEmpty();
        assertThat(store.getMessages()).hasSize(1);
    }

    @Test
    void submit_shouldKeepDraftWhenNothingIsSelected() {
        store.setSelectedConversation(null);
        MessageDraft draft = new MessageDraft();
        draft.setText("bonjour");

        SendResult result = pipeline.submit(draft).join();

        assertThat(result).isEqualTo(SendResult.REJECTED);
        assertThat(draft.getText()).isEqualTo("bonjour");
        verifyNoInteractions(api);
    }
}
