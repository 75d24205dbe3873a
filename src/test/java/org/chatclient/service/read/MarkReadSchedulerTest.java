package org.chatclient.service.read;

import org.chatclient.exception.ChatApiException;
import org.chatclient.exception.SessionExpiredException;
import org.chatclient.model.Conversation;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.loop.KeyedTimers;
import org.chatclient.service.store.ConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarkReadSchedulerTest {

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ChatApiClient api;

    @Mock
    private AuthFailureHandler authFailure;

    private final List<Runnable> scheduled = new ArrayList<>();
    private ConversationStore store;
    private MarkReadScheduler markRead;

    @BeforeEach
    void init() {
        lenient().when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(inv -> {
                    scheduled.add(inv.getArgument(0));
                    return mock(ScheduledFuture.class);
                });
        store = new ConversationStore();
        store.setConversations(List.of(Conversation.builder().id("c1")
                .participant(User.ofId("u2")).unreadCount(4).build()));
        markRead = new MarkReadScheduler(new KeyedTimers(scheduler), store, api, EventLoop.direct(),
                authFailure, 250);
    }

    // le dernier minuteur programmé est le seul encore valide
    private void fireLast() {
        scheduled.get(scheduled.size() - 1).run();
    }

    @Test
    void schedule_shouldSendSingleRequestForBurst() {
        markRead.schedule("c1");
        markRead.schedule("c1");
        markRead.schedule("c1");

        assertThat(markRead.isScheduled("c1")).isTrue();
        fireLast();

        verify(api, times(1)).markRead("c1");
        assertThat(markRead.isScheduled("c1")).isFalse();
    }

    @Test
    void schedule_shouldZeroUnreadLocallyWhenFired() {
        markRead.schedule("c1");
        fireLast();

        assertThat(store.getConversations().get(0).getUnreadCount()).isZero();
    }

    @Test
    void schedule_shouldIgnoreTemporaryOrBlankId() {
        markRead.schedule("temp_123");
        markRead.schedule(" ");
        markRead.schedule(null);

        assertThat(scheduled).isEmpty();
        verifyNoInteractions(api);
    }

    @Test
    void schedule_shouldSwallowNetworkFailureWithoutNotification() {
        doThrow(new ChatApiException(500, "boom")).when(api).markRead("c1");
        markRead.schedule("c1");

        assertThatCode(this::fireLast).doesNotThrowAnyException();

        verifyNoInteractions(authFailure);
        assertThat(store.getConversations().get(0).getUnreadCount()).isZero();
    }

    @Test
    void schedule_shouldNotifyHandlerOnSessionExpired() {
        doThrow(new SessionExpiredException(401)).when(api).markRead(anyString());
        markRead.schedule("c1");

        fireLast();

        verify(authFailure).onSessionExpired();
    }

    @Test
    void cancelAll_shouldCancelPendingTimers() {
        markRead.schedule("c1");
        markRead.cancelAll();

        assertThat(markRead.isScheduled("c1")).isFalse();
    }
}
