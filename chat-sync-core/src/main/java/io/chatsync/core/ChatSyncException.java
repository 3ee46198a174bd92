package io.chatsync.core;

/**
 * Base class for failures surfaced by the synchronization engine.
 *
 * <p>Messages are user-displayable. The original cause is preserved when there is one.
 */
public abstract class ChatSyncException extends RuntimeException {

    protected ChatSyncException(String message) {
        super(message);
    }

    protected ChatSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Loading message history failed. Recoverable through a manual refresh.
     */
    public static class FetchFailed extends ChatSyncException {
        public FetchFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The live subscription failed at transport level. Absorbed by the reconnect loop.
     */
    public static class SubscriptionFailed extends ChatSyncException {
        public SubscriptionFailed(String message) {
            super(message);
        }

        public SubscriptionFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A payload could not be turned into a {@link Message}.
     */
    public static class DecodeFailed extends ChatSyncException {
        public DecodeFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Appending a message failed. The pending entry identified by {@link #token()} stays in the
     * view marked as failed until it is retried or discarded.
     */
    public static class SendFailed extends ChatSyncException {
        private final String token;

        public SendFailed(String token, String message, Throwable cause) {
            super(message, cause);
            this.token = token;
        }

        /**
         * Correlation token of the failed pending send, or {@code null} when the send was rejected
         * before a pending entry was created.
         */
        public String token() {
            return token;
        }
    }
}
