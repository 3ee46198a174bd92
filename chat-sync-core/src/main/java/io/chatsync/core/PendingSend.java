package io.chatsync.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A locally authored message that the server has not confirmed yet.
 *
 * <p>The {@code token} correlates the entry with the outcome of its append call. A pending send
 * is either {@link Status#IN_FLIGHT} or {@link Status#FAILED}; a confirmed send is not pending any
 * more and is represented by its {@link Message}.
 *
 * @param token client-generated correlation token
 * @param conversationId target conversation
 * @param senderId the local user
 * @param content trimmed message text
 * @param submittedAt client clock at submission, used as the provisional timestamp
 * @param status current delivery status
 * @param failureReason user-displayable reason, present only when {@code FAILED}
 */
public record PendingSend(
        String token,
        String conversationId,
        String senderId,
        String content,
        Instant submittedAt,
        Status status,
        String failureReason
) {

    public enum Status {
        IN_FLIGHT,
        FAILED
    }

    public PendingSend {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(submittedAt, "submittedAt");
        Objects.requireNonNull(status, "status");
        if (status == Status.IN_FLIGHT) {
            failureReason = null;
        }
    }

    public static PendingSend create(String conversationId, String senderId, String content, Instant submittedAt) {
        return new PendingSend(UUID.randomUUID().toString(), conversationId, senderId, content, submittedAt,
                Status.IN_FLIGHT, null);
    }

    public PendingSend failed(String reason) {
        return new PendingSend(token, conversationId, senderId, content, submittedAt, Status.FAILED, reason);
    }

    public PendingSend inFlight() {
        return new PendingSend(token, conversationId, senderId, content, submittedAt, Status.IN_FLIGHT, null);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Whether {@code message} is a plausible server echo of this send: same conversation, same
     * author and same text.
     */
    public boolean matches(Message message) {
        return conversationId.equals(message.conversationId())
                && senderId.equals(message.senderId())
                && content.equals(message.content());
    }
}
