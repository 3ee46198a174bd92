package io.chatsync.remote;

/**
 * A raw row could not be decoded into a message.
 */
public class MessageDecodeException extends Exception {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
