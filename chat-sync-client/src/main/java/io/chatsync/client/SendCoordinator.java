package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.Message;
import io.chatsync.core.PendingSend;
import io.chatsync.remote.MessageDecodeException;
import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteAppend;
import io.chatsync.remote.RemoteStoreException;
import io.chatsync.remote.SessionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Optimistic sends: the pending entry appears in the view immediately and the append runs on the
 * I/O executor. Failed sends stay in the view until retried or discarded; nothing is retried
 * automatically.
 */
public final class SendCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SendCoordinator.class);

    private final String conversationId;
    private final MessageStore store;
    private final RemoteAppend remote;
    private final MessageDecoder decoder;
    private final SessionProvider session;
    private final Executor executor;
    private final Clock clock;
    private final Consumer<ChatSyncException> errors;
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    private volatile boolean cancelled;

    public SendCoordinator(MessageStore store, RemoteAppend remote, MessageDecoder decoder, SessionProvider session,
                           Executor executor, Clock clock, Consumer<ChatSyncException> errors) {
        this.store = Objects.requireNonNull(store, "store");
        this.conversationId = store.conversationId();
        this.remote = Objects.requireNonNull(remote, "remote");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.session = Objects.requireNonNull(session, "session");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /**
     * Submits a message.
     *
     * @return the pending token, or empty when the content is blank, nobody is signed in, or the
     *         coordinator was cancelled
     */
    public Optional<String> send(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            log.debug("Ignoring blank message for conversation {}", conversationId);
            return Optional.empty();
        }
        if (cancelled) return Optional.empty();

        String senderId = session.currentUserId();
        if (senderId == null || senderId.isBlank()) {
            log.warn("Send to conversation {} rejected: no signed-in user", conversationId);
            errors.accept(new ChatSyncException.SendFailed(null, Failures.NOT_SIGNED_IN, null));
            return Optional.empty();
        }

        PendingSend send = PendingSend.create(conversationId, senderId, text, clock.instant());
        store.addPending(send);
        dispatch(send);
        return Optional.of(send.token());
    }

    public boolean retryFailed(String token) {
        Objects.requireNonNull(token, "token");
        if (cancelled || !store.markInFlight(token)) return false;
        Optional<PendingSend> send = store.pending(token);
        if (send.isEmpty()) return false;
        log.debug("Retrying send {} on conversation {}", token, conversationId);
        dispatch(send.get());
        return true;
    }

    public boolean discardFailed(String token) {
        Objects.requireNonNull(token, "token");
        return store.discard(token);
    }

    /**
     * Number of appends dispatched and not yet settled.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Stops dispatching. Appends that have not started are skipped; results of running ones are
     * discarded by the closed store.
     */
    public void cancelAll() {
        cancelled = true;
        for (CompletableFuture<Void> f : inFlight.values()) {
            f.cancel(true);
        }
        inFlight.clear();
    }

    private void dispatch(PendingSend send) {
        String token = send.token();
        CompletableFuture<Void> f = CompletableFuture.runAsync(() -> deliver(send), executor);
        inFlight.put(token, f);
        f.whenComplete((ignored, error) -> {
            inFlight.remove(token, f);
            if (error != null && !Failures.isCancellation(error)) {
                log.warn("Send {} on conversation {} ended unexpectedly", token, conversationId, Failures.unwrap(error));
            }
        });
    }

    private void deliver(PendingSend send) {
        if (cancelled) return;
        RawMessage row;
        try {
            row = remote.insert(conversationId, send.senderId(), send.content());
        } catch (RemoteStoreException e) {
            fail(send, Failures.send(e), e);
            return;
        } catch (RuntimeException e) {
            fail(send, "Error sending message: " + e.getMessage(), e);
            return;
        }

        Message confirmed;
        try {
            confirmed = decoder.decode(row);
        } catch (MessageDecodeException e) {
            // the row exists remotely; its live echo or the next history refresh settles the entry
            log.warn("Confirmation of send {} is unreadable, awaiting echo", send.token(),
                    new ChatSyncException.DecodeFailed(e.getMessage(), e));
            return;
        }
        if (!confirmed.conversationId().equals(conversationId)) {
            fail(send, "Message was stored in another conversation", null);
            return;
        }
        if (cancelled || !store.reconcile(confirmed, send.token())) {
            log.debug("Confirmation {} of send {} had no effect", confirmed.id(), send.token());
        }
    }

    private void fail(PendingSend send, String reason, Throwable cause) {
        if (cancelled || store.isClosed()) {
            log.debug("Discarding failure of send {} after shutdown", send.token());
            return;
        }
        log.warn("Send {} on conversation {} failed: {}", send.token(), conversationId, reason);
        store.markFailed(send.token(), reason);
        errors.accept(new ChatSyncException.SendFailed(send.token(), reason, cause));
    }
}
