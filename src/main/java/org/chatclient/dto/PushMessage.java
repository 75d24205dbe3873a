package org.chatclient.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushMessage {
    @JsonAlias("_id")
    private String id;
    @JsonAlias("message")
    private String content;
    private String senderId;
    private String receiverId;
    private String createdAt;
}
