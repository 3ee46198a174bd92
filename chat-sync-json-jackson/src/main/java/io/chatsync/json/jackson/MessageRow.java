package io.chatsync.json.jackson;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Binding target for one {@code messages} row. Older rows name the text column {@code text}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class MessageRow {

    @JsonProperty("id")
    String id;

    @JsonProperty("group_id")
    @JsonAlias("conversation_id")
    String conversationId;

    @JsonProperty("sender_id")
    String senderId;

    @JsonProperty("content")
    @JsonAlias("text")
    String content;

    @JsonProperty("timestamp")
    @JsonAlias("created_at")
    Instant timestamp;
}
