package org.chatclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Identité persistée localement ({id, username}) avec le jeton de session à rejouer. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredIdentity {
    private String id;
    private String username;
    @ToString.Exclude
    private String token;

    public StoredIdentity(String id, String username) {
        this(id, username, null);
    }
}
