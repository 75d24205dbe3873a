package org.chatclient.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.chatclient.model.User;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.auth.AuthFailureHandler;
import org.chatclient.service.ingress.ConversationNormalizer;
import org.chatclient.service.loop.EventLoop;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.realtime.PresenceTracker;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Annuaire des utilisateurs (recherche "nouvelle conversation") et profil courant. */
@Slf4j
public class UserDirectory {

    static final String USERS_FAILED = "Impossible de charger les utilisateurs";
    static final String PROFILE_FAILED = "Impossible de charger le profil";

    private final ChatApiClient api;
    private final EventLoop loop;
    private final NotificationCenter notifier;
    private final AuthFailureHandler authFailure;
    private final PresenceTracker presence;

    private volatile List<User> users = List.of();
    private volatile User currentUser;

    public UserDirectory(ChatApiClient api, EventLoop loop, NotificationCenter notifier,
                         AuthFailureHandler authFailure, PresenceTracker presence) {
        this.api = api;
        this.loop = loop;
        this.notifier = notifier;
        this.authFailure = authFailure;
        this.presence = presence;
    }

    public CompletableFuture<FetchResult<List<User>>> fetchUsers() {
        return loop.call(api::getUsers)
                .thenApply(payloads -> {
                    List<User> loaded = ConversationNormalizer.toUsers(payloads);
                    users = loaded;
                    return FetchResult.ok(loaded);
                })
                .exceptionally(e -> FetchFailures.handle(e, USERS_FAILED, authFailure, notifier));
    }

    public CompletableFuture<FetchResult<User>> fetchCurrentUser() {
        return loop.call(api::getCurrentUser)
                .thenApply(payload -> {
                    User me = payload != null ? ConversationNormalizer.toUser(payload) : null;
                    currentUser = me;
                    return FetchResult.ok(me);
                })
                .exceptionally(e -> FetchFailures.handle(e, PROFILE_FAILED, authFailure, notifier));
    }

    // user:created
    public void onUserCreated() {
        log.debug("Nouvel utilisateur inscrit : rechargement de l'annuaire");
        fetchUsers();
    }

    /** Annuaire courant, statut en ligne à jour. */
    public List<User> getUsers() {
        return presence.decorate(users);
    }

    public User getCurrentUser() {
        return presence.decorate(currentUser);
    }
}
