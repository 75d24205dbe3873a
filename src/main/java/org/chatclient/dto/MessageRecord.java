package org.chatclient.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Message persisté : {_id, message, createdAt, senderId}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageRecord {
    @JsonProperty("_id")
    @JsonAlias("id")
    private String id;
    @JsonAlias("content")
    private String message;
    private String createdAt;
    private String senderId;
}
