package org.chatclient.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversation telle qu'elle arrive du serveur (REST, conversation:created,
 * conversation:updated). Les champs variables restent en JsonNode :
 * participants en ids bruts ou en objets, lastMessage en content/message ou chaîne.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationPayload {
    @JsonProperty("_id")
    @JsonAlias("id")
    private String id;
    private JsonNode participants;
    private JsonNode lastMessage;
    private JsonNode unreadCount;
}
