package org.chatclient.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder(toBuilder = true)
public class User {
    String id;
    String fullName;
    String username;
    String profilePicture;   // optionnel
    String createdAt;
    // dérivé de l'ensemble des utilisateurs connectés, jamais persisté
    @With boolean online;

    public static User ofId(String id) {
        return User.builder().id(id).build();
    }

    /** Vrai si le participant porte au moins un nom affichable (sinon : à hydrater). */
    public boolean hasDisplayName() {
        return (fullName != null && !fullName.isBlank())
                || (username != null && !username.isBlank());
    }
}
