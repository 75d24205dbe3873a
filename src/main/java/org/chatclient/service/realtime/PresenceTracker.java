package org.chatclient.service.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import org.chatclient.model.User;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Ensemble des utilisateurs connectés, remplacé à chaque événement onlineUsers. */
public class PresenceTracker {

    private volatile Set<String> online = Set.of();

    public void onOnlineUsers(JsonNode payload) {
        if (payload == null || !payload.isArray()) {
            online = Set.of();
            return;
        }
        Set<String> ids = new HashSet<>();
        for (JsonNode id : payload) {
            if (id != null && id.isValueNode() && !id.isNull()) ids.add(id.asText());
        }
        online = Set.copyOf(ids);
    }

    public boolean isOnline(String userId) {
        return userId != null && online.contains(userId);
    }

    public Set<String> onlineIds() {
        return online;
    }

    public User decorate(User user) {
        return user == null ? null : user.withOnline(isOnline(user.getId()));
    }

    public List<User> decorate(List<User> users) {
        return users.stream().map(this::decorate).toList();
    }
}
