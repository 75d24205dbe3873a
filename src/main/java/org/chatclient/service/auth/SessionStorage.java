package org.chatclient.service.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.chatclient.dto.StoredIdentity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Identité minimale {id, username} conservée entre deux lancements. */
@Slf4j
@Component
public class SessionStorage {

    private final ObjectMapper objectMapper;
    private final Path file;

    public SessionStorage(ObjectMapper objectMapper,
                          @Value("${chat.session.file:${user.home}/.chat-client/user.json}") String file) {
        this.objectMapper = objectMapper;
        this.file = Path.of(file);
    }

    public Optional<StoredIdentity> read() {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            StoredIdentity identity = objectMapper.readValue(file.toFile(), StoredIdentity.class);
            if (identity == null || identity.getId() == null) return Optional.empty();
            return Optional.of(identity);
        } catch (IOException e) {
            // fichier corrompu : traité comme absent
            log.warn("Session locale illisible ({}) : {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(StoredIdentity identity) {
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writeValue(file.toFile(), identity);
        } catch (IOException e) {
            throw new IllegalStateException("Impossible d'enregistrer la session locale", e);
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Impossible d'effacer la session locale ({}) : {}", file, e.getMessage());
        }
    }
}
