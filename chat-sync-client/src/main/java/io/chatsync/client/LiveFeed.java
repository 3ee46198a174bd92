package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.Message;
import io.chatsync.remote.ChannelStatus;
import io.chatsync.remote.MessageDecodeException;
import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteSubscription;
import io.chatsync.remote.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live subscription to inserts of one conversation.
 *
 * <p>Each {@link #open(Listener)} starts a new generation and cancels the previous one; callbacks
 * of stale generations are ignored. Undecodable rows and rows of other conversations are logged
 * and dropped without ending the subscription.
 */
public final class LiveFeed {

    private static final Logger log = LoggerFactory.getLogger(LiveFeed.class);

    /**
     * Receives the events of the current generation.
     */
    public interface Listener {
        void onStatus(ChannelStatus status);

        void onMessage(Message message);

        void onError(Throwable error);

        /**
         * The remote ended the subscription without an error.
         */
        void onClosed();
    }

    private final RemoteSubscription remote;
    private final MessageDecoder decoder;
    private final String conversationId;
    private final Object guard = new Object();
    private final AtomicLong dropped = new AtomicLong();

    private volatile Generation current;
    private long generations;

    public LiveFeed(RemoteSubscription remote, MessageDecoder decoder, String conversationId) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
    }

    public String conversationId() {
        return conversationId;
    }

    public void open(Listener listener) {
        Objects.requireNonNull(listener, "listener");
        Generation previous;
        Generation next;
        synchronized (guard) {
            previous = current;
            next = new Generation(++generations, listener);
            current = next;
        }
        if (previous != null) previous.cancel();
        log.debug("Opening live feed of conversation {} (generation {})", conversationId, next.id);
        try {
            remote.open(conversationId).subscribe(next);
        } catch (RuntimeException e) {
            next.onError(e);
        }
    }

    /**
     * Cancels the current generation, if any. Idempotent.
     */
    public void close() {
        Generation g;
        synchronized (guard) {
            g = current;
            current = null;
        }
        if (g != null) {
            log.debug("Closing live feed of conversation {} (generation {})", conversationId, g.id);
            g.cancel();
        }
    }

    public boolean isOpen() {
        return current != null;
    }

    /**
     * Rows dropped because they could not be decoded or belonged to another conversation.
     */
    public long droppedRows() {
        return dropped.get();
    }

    private boolean detach(Generation g) {
        synchronized (guard) {
            if (current != g) return false;
            current = null;
            return true;
        }
    }

    private final class Generation implements Flow.Subscriber<SubscriptionEvent> {
        private final long id;
        private final Listener listener;
        private volatile Flow.Subscription subscription;
        private volatile boolean cancelled;

        private Generation(long id, Listener listener) {
            this.id = id;
            this.listener = listener;
        }

        @Override
        public void onSubscribe(Flow.Subscription s) {
            subscription = s;
            if (cancelled) {
                s.cancel();
                return;
            }
            s.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(SubscriptionEvent event) {
            if (current != this) return;
            if (event instanceof SubscriptionEvent.StatusChanged status) {
                listener.onStatus(status.status());
            } else if (event instanceof SubscriptionEvent.RowInserted row) {
                deliver(row.row());
            }
        }

        @Override
        public void onError(Throwable error) {
            if (!detach(this)) return;
            listener.onError(error);
        }

        @Override
        public void onComplete() {
            if (!detach(this)) return;
            listener.onClosed();
        }

        private void deliver(RawMessage raw) {
            Message m;
            try {
                m = decoder.decode(raw);
            } catch (MessageDecodeException e) {
                dropped.incrementAndGet();
                log.warn("Dropping undecodable row on conversation {}",
                        conversationId, new ChatSyncException.DecodeFailed(e.getMessage(), e));
                return;
            }
            if (!m.conversationId().equals(conversationId)) {
                dropped.incrementAndGet();
                log.warn("Dropping message {} of conversation {} received on {}", m.id(), m.conversationId(), conversationId);
                return;
            }
            try {
                listener.onMessage(m);
            } catch (RuntimeException e) {
                log.error("Listener failed on message {} of conversation {}", m.id(), conversationId, e);
            }
        }

        private void cancel() {
            cancelled = true;
            Flow.Subscription s = subscription;
            if (s != null) s.cancel();
        }
    }
}
