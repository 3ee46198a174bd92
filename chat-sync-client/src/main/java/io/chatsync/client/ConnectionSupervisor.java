package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.ConnectionState;
import io.chatsync.core.Message;
import io.chatsync.remote.ChannelStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one {@link LiveFeed} subscribed and reconnects it with backoff when it fails.
 *
 * <pre>
 * Disconnected --connect--&gt; Connecting --SUBSCRIBED--&gt; Subscribed
 * Connecting | Subscribed --failure--&gt; Degraded --timer--&gt; Reconnecting(n) --&gt; Connecting
 * any --disconnect--&gt; Disconnected (terminal)
 * </pre>
 *
 * <p>After {@code maxReconnectAttempts} consecutive failed reconnects the state becomes
 * {@code Degraded(exhausted=true)} and nothing more is scheduled until {@link #reconnectNow()}.
 * Connection failures are logged only; observers learn about them through state changes.
 */
public final class ConnectionSupervisor implements LiveFeed.Listener {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    /**
     * Callbacks of a supervisor. State changes are delivered in transition order.
     */
    public interface Observer {
        void onMessage(Message message);

        void onStateChanged(ConnectionState state);

        /**
         * The feed is subscribed again after having been lost.
         */
        default void onResubscribed() {}
    }

    private final LiveFeed feed;
    private final ScheduledExecutorService scheduler;
    private final ReconnectBackoff backoff;
    private final int maxReconnectAttempts;
    private final Observer observer;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private boolean started;
    private boolean terminated;
    private boolean everSubscribed;
    private int attempts;
    private ScheduledFuture<?> pendingReconnect;

    /**
     * @param maxReconnectAttempts consecutive failed reconnects before giving up; 0 retries forever
     */
    public ConnectionSupervisor(LiveFeed feed, ScheduledExecutorService scheduler, ReconnectBackoff backoff,
                                int maxReconnectAttempts, Observer observer) {
        if (maxReconnectAttempts < 0) throw new IllegalArgumentException("maxReconnectAttempts must not be negative");
        this.feed = Objects.requireNonNull(feed, "feed");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * Reconnect attempts made since the feed was last subscribed.
     */
    public int attempts() {
        lock.lock();
        try {
            return attempts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the feed. Only the first call has an effect.
     *
     * @throws IllegalStateException if the supervisor was disconnected
     */
    public void connect() {
        lock.lock();
        try {
            if (terminated) throw new IllegalStateException("Supervisor was disconnected");
            if (started) return;
            started = true;
            transition(ConnectionState.CONNECTING);
            feed.open(this);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the attempt counter and reconnects immediately when the connection is degraded.
     *
     * @return whether a reconnect was started
     */
    public boolean reconnectNow() {
        lock.lock();
        try {
            if (terminated || !(state instanceof ConnectionState.Degraded)) return false;
            cancelTimer();
            attempts = 0;
            log.debug("Manual reconnect of conversation {}", feed.conversationId());
            reopen();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the feed and cancels any scheduled reconnect. Terminal and idempotent.
     */
    public void disconnect() {
        lock.lock();
        try {
            if (terminated) return;
            terminated = true;
            cancelTimer();
            feed.close();
            transition(ConnectionState.DISCONNECTED);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onStatus(ChannelStatus status) {
        if (status == ChannelStatus.SUBSCRIBED) {
            subscribed();
        } else {
            degrade("Channel " + status.name().toLowerCase(), null);
        }
    }

    @Override
    public void onMessage(Message message) {
        if (terminated) return;
        observer.onMessage(message);
    }

    @Override
    public void onError(Throwable error) {
        degrade(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage(), error);
    }

    @Override
    public void onClosed() {
        degrade("Channel closed by server", null);
    }

    private void subscribed() {
        boolean resubscribed;
        lock.lock();
        try {
            if (terminated || !(state instanceof ConnectionState.Connecting)) return;
            resubscribed = everSubscribed;
            everSubscribed = true;
            attempts = 0;
            transition(ConnectionState.SUBSCRIBED);
        } finally {
            lock.unlock();
        }
        if (resubscribed) observer.onResubscribed();
    }

    private void degrade(String reason, Throwable cause) {
        lock.lock();
        try {
            if (terminated) return;
            if (!(state instanceof ConnectionState.Connecting) && !(state instanceof ConnectionState.Subscribed)) return;
            feed.close();
            log.warn("Live feed of conversation {} degraded: {}", feed.conversationId(), reason,
                    new ChatSyncException.SubscriptionFailed(reason, cause));
            if (maxReconnectAttempts > 0 && attempts >= maxReconnectAttempts) {
                log.warn("Giving up on conversation {} after {} reconnect attempts", feed.conversationId(), attempts);
                transition(new ConnectionState.Degraded(reason, true));
                return;
            }
            transition(new ConnectionState.Degraded(reason, false));
            long delay = backoff.delayMillis(attempts + 1);
            try {
                pendingReconnect = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
                log.debug("Reconnect {} of conversation {} in {} ms", attempts + 1, feed.conversationId(), delay);
            } catch (RejectedExecutionException e) {
                log.warn("Reconnect scheduler unavailable for conversation {}", feed.conversationId(), e);
                transition(new ConnectionState.Degraded(reason, true));
            }
        } finally {
            lock.unlock();
        }
    }

    private void reconnect() {
        lock.lock();
        try {
            pendingReconnect = null;
            if (terminated || !(state instanceof ConnectionState.Degraded)) return;
            reopen();
        } finally {
            lock.unlock();
        }
    }

    // guarded by lock
    private void reopen() {
        attempts++;
        transition(new ConnectionState.Reconnecting(attempts));
        feed.close();
        transition(ConnectionState.CONNECTING);
        feed.open(this);
    }

    private void cancelTimer() {
        ScheduledFuture<?> f = pendingReconnect;
        pendingReconnect = null;
        if (f != null) f.cancel(false);
    }

    private void transition(ConnectionState next) {
        ConnectionState prev = state;
        state = next;
        log.debug("Conversation {}: {} -> {}", feed.conversationId(), prev, next);
        observer.onStateChanged(next);
    }
}
