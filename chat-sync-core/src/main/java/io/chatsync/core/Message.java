package io.chatsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A server-confirmed chat message.
 *
 * @param id server-assigned identity, unique within a conversation
 * @param conversationId the conversation (group) this message belongs to
 * @param senderId the author
 * @param content message text, never blank
 * @param createdAt server-assigned timestamp
 */
public record Message(String id, String conversationId, String senderId, String content, Instant createdAt) {

    public Message {
        requireText(id, "id");
        requireText(conversationId, "conversationId");
        requireText(senderId, "senderId");
        Objects.requireNonNull(content, "content");
        if (content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean sentBy(String userId) {
        return userId != null && userId.equals(senderId);
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
