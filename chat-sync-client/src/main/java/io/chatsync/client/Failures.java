package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.remote.RemoteStoreException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * User-facing wording for remote failures, and unwrapping of async exceptions.
 */
final class Failures {

    static final String NOT_SIGNED_IN = "Authentication error: sign in to send messages.";

    private Failures() {}

    static String fetch(RemoteStoreException e) {
        if (e.status() == RemoteStoreException.NO_STATUS) {
            return "Network error loading messages. Please check your connection.";
        }
        return "Could not load messages (status " + e.status() + "): " + e.getMessage();
    }

    static String send(RemoteStoreException e) {
        if (e.status() == RemoteStoreException.NO_STATUS) {
            return "Network error sending message. Please try again.";
        }
        return "Could not send message (status " + e.status() + "): " + e.getMessage();
    }

    static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    static boolean isCancellation(Throwable t) {
        return unwrap(t) instanceof CancellationException;
    }

    static ChatSyncException asFetchFailed(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof ChatSyncException.FetchFailed f) return f;
        return new ChatSyncException.FetchFailed("Error loading messages: " + cause.getMessage(), cause);
    }
}
