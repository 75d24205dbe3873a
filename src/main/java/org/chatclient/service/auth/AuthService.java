package org.chatclient.service.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.config.SessionCookieInterceptor;
import org.chatclient.dto.AuthRequest;
import org.chatclient.dto.AuthResponse;
import org.chatclient.dto.SignupRequest;
import org.chatclient.dto.StoredIdentity;
import org.chatclient.exception.ChatApiException;
import org.chatclient.service.api.ChatApiClient;
import org.chatclient.service.notify.NotificationCenter;
import org.chatclient.service.session.ChatSessionManager;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Connexion, inscription, déconnexion. Une authentification réussie enregistre
 * {id, username} et le jeton de session localement, puis ouvre une session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String FIELDS_REQUIRED = "Tous les champs sont obligatoires";
    static final String PASSWORD_MISMATCH = "Les mots de passe ne correspondent pas";
    static final String PASSWORD_TOO_SHORT = "Le mot de passe doit contenir au moins 6 caractères";
    static final String LOGIN_FAILED = "Identifiants invalides";
    static final String SIGNUP_FAILED = "Inscription impossible";
    static final int MIN_PASSWORD_LENGTH = 6;

    private final ChatApiClient api;
    private final SessionStorage storage;
    private final ChatSessionManager sessions;
    private final SessionCookieInterceptor cookies;
    private final NotificationCenter notifier;

    public Optional<StoredIdentity> login(String username, String password) {
        if (isBlank(username) || isBlank(password)) {
            notifier.error(FIELDS_REQUIRED);
            return Optional.empty();
        }
        try {
            AuthResponse res = api.login(new AuthRequest(username.trim(), password));
            return open(res, LOGIN_FAILED);
        } catch (ChatApiException e) {
            log.warn("Connexion refusée pour {} : {}", username, e.getMessage());
            notifier.error(LOGIN_FAILED);
            return Optional.empty();
        }
    }

    public Optional<StoredIdentity> signup(SignupRequest request) {
        String error = validate(request);
        if (error != null) {
            notifier.error(error);
            return Optional.empty();
        }
        try {
            return open(api.signup(request), SIGNUP_FAILED);
        } catch (ChatApiException e) {
            log.warn("Inscription refusée pour {} : {}", request.getUsername(), e.getMessage());
            notifier.error(SIGNUP_FAILED);
            return Optional.empty();
        }
    }

    /** Le serveur efface le cookie ; l'état local est effacé même si l'appel échoue. */
    public void logout() {
        try {
            api.logout();
        } catch (ChatApiException e) {
            log.warn("Déconnexion côté serveur en échec : {}", e.getMessage());
        } finally {
            storage.clear();
            cookies.clear();
            sessions.end();
        }
    }

    /**
     * Reprise de la session enregistrée au démarrage, sans appel réseau. Le jeton
     * persisté est rejoué ; une identité sans jeton est effacée, le serveur la refuserait.
     */
    public Optional<StoredIdentity> restore() {
        Optional<StoredIdentity> identity = storage.read();
        if (identity.isEmpty()) return identity;
        StoredIdentity saved = identity.get();
        if (isBlank(saved.getToken())) {
            log.info("Session locale de {} sans jeton, nouvelle connexion requise", saved.getUsername());
            storage.clear();
            return Optional.empty();
        }
        log.info("Reprise de la session de {}", saved.getUsername());
        cookies.restore(saved.getToken());
        sessions.start(saved);
        return identity;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        restore();
    }

    static String validate(SignupRequest r) {
        if (r == null || isBlank(r.getFullName()) || isBlank(r.getUsername()) || isBlank(r.getPassword())
                || isBlank(r.getConfirmPassword()) || isBlank(r.getGender())) {
            return FIELDS_REQUIRED;
        }
        if (!r.getPassword().equals(r.getConfirmPassword())) return PASSWORD_MISMATCH;
        if (r.getPassword().length() < MIN_PASSWORD_LENGTH) return PASSWORD_TOO_SHORT;
        return null;
    }

    private Optional<StoredIdentity> open(AuthResponse res, String failure) {
        if (res == null || res.getUser() == null || res.getUser().getId() == null) {
            notifier.error(failure);
            return Optional.empty();
        }
        StoredIdentity identity = new StoredIdentity(res.getUser().getId(), res.getUser().getUsername(),
                cookies.token());
        storage.write(identity);
        sessions.start(identity);
        notifier.success("Bienvenue " + identity.getUsername());
        return Optional.of(identity);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
