package org.chatclient.service.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.chatclient.model.User;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceTrackerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PresenceTracker presence = new PresenceTracker();

    @Test
    void onOnlineUsers_shouldReplaceOnlineSet() throws Exception {
        presence.onOnlineUsers(mapper.readTree("[\"u1\",\"u2\"]"));
        presence.onOnlineUsers(mapper.readTree("[\"u3\"]"));

        assertThat(presence.isOnline("u1")).isFalse();
        assertThat(presence.isOnline("u3")).isTrue();
    }

    @Test
    void onOnlineUsers_shouldClearSetOnUnexpectedShape() throws Exception {
        presence.onOnlineUsers(mapper.readTree("[\"u1\"]"));
        presence.onOnlineUsers(mapper.readTree("{\"u1\":true}"));

        assertThat(presence.onlineIds()).isEmpty();
    }

    @Test
    void decorate_shouldDeriveOnlineStatus() throws Exception {
        presence.onOnlineUsers(mapper.readTree("[\"u2\"]"));

        List<User> out = presence.decorate(List.of(User.ofId("u1"), User.ofId("u2")));

        assertThat(out).extracting(User::isOnline).containsExactly(false, true);
        assertThat(presence.decorate((User) null)).isNull();
    }
}
