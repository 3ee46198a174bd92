package io.chatsync.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory backend implementing history, append and subscription.
 *
 * <p>Good for unit tests and examples. Not intended for production.
 *
 * <p>Ids are random UUIDs and timestamps come from the supplied {@link Clock}, the way a database
 * assigns them on insert. Faults can be injected with {@link #failNextFetches(int)},
 * {@link #failNextAppends(int)}, {@link #failNextOpens(int)} and {@link #dropSubscribers(String)}.
 *
 * <p>Subscription events are delivered on the executor passed to the constructor. Passing
 * {@code Runnable::run} delivers them on the calling thread, which makes tests deterministic.
 */
public final class InMemoryRemoteStore implements RemoteHistoryQuery, RemoteAppend, RemoteSubscription {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteStore.class);

    private final Map<String, ConversationLog> conversations = new ConcurrentHashMap<>();
    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Executor deliveryExecutor;

    private final AtomicInteger fetchFailures = new AtomicInteger();
    private final AtomicInteger appendFailures = new AtomicInteger();
    private final AtomicInteger openFailures = new AtomicInteger();

    public InMemoryRemoteStore() {
        this(Clock.systemUTC(), ForkJoinPool.commonPool());
    }

    public InMemoryRemoteStore(Clock clock, Executor deliveryExecutor) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "deliveryExecutor");
    }

    @Override
    public List<RawMessage> fetchRecent(String conversationId, int limit) throws RemoteStoreException {
        Objects.requireNonNull(conversationId, "conversationId");
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        if (consume(fetchFailures)) throw new RemoteStoreException("history query failed", 503, null);

        ConversationLog c = conversations.get(conversationId);
        if (c == null) return List.of();
        return c.recent(limit);
    }

    @Override
    public RawMessage insert(String conversationId, String senderId, String content) throws RemoteStoreException {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(content, "content");
        if (consume(appendFailures)) throw new RemoteStoreException("insert rejected", 503, null);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(RawMessage.COL_ID, UUID.randomUUID().toString());
        row.put(RawMessage.COL_CONVERSATION, conversationId);
        row.put(RawMessage.COL_SENDER, senderId);
        row.put(RawMessage.COL_CONTENT, content);
        row.put(RawMessage.COL_TIMESTAMP, clock.instant().toString());
        RawMessage raw = new RawMessage(row);

        conversations.computeIfAbsent(conversationId, k -> new ConversationLog()).append(raw);
        broadcast(conversationId, new SubscriptionEvent.RowInserted(raw));
        return raw;
    }

    /**
     * Stores a row as-is and pushes it to subscribers of {@code conversationId}, bypassing
     * validation. Used to simulate rows written by other clients or malformed payloads.
     */
    public void inject(String conversationId, RawMessage raw) {
        Objects.requireNonNull(raw, "raw");
        conversations.computeIfAbsent(conversationId, k -> new ConversationLog()).append(raw);
        broadcast(conversationId, new SubscriptionEvent.RowInserted(raw));
    }

    /**
     * Pushes an event to subscribers of {@code conversationId} without storing anything.
     */
    public void emit(String conversationId, SubscriptionEvent event) {
        broadcast(conversationId, Objects.requireNonNull(event, "event"));
    }

    @Override
    public Flow.Publisher<SubscriptionEvent> open(String conversationId) {
        Objects.requireNonNull(conversationId, "conversationId");
        return subscriber -> {
            Objects.requireNonNull(subscriber, "subscriber");
            Channel ch = new Channel(conversationId, new SubmissionPublisher<>(deliveryExecutor, Flow.defaultBufferSize()));
            ch.pub.subscribe(new ChannelSubscriber(ch, subscriber));
            if (consume(openFailures)) {
                log.debug("Rejecting subscription to conversation {}", conversationId);
                ch.open = false;
                ch.pub.closeExceptionally(new RemoteStoreException("subscription rejected"));
                return;
            }
            channels.add(ch);
            ch.pub.submit(new SubscriptionEvent.StatusChanged(ChannelStatus.SUBSCRIBED));
        };
    }

    /**
     * Terminates every open channel of a conversation with a transport error.
     *
     * @return number of channels dropped
     */
    public int dropSubscribers(String conversationId) {
        int dropped = 0;
        for (Channel ch : channels) {
            if (ch.conversationId.equals(conversationId) && ch.open) {
                ch.open = false;
                channels.remove(ch);
                ch.pub.closeExceptionally(new RemoteStoreException("connection lost"));
                dropped++;
            }
        }
        return dropped;
    }

    /**
     * Number of channels currently open for a conversation.
     */
    public int subscriberCount(String conversationId) {
        int n = 0;
        for (Channel ch : channels) {
            if (ch.conversationId.equals(conversationId) && ch.open) n++;
        }
        return n;
    }

    public void failNextFetches(int count) {
        fetchFailures.set(count);
    }

    public void failNextAppends(int count) {
        appendFailures.set(count);
    }

    public void failNextOpens(int count) {
        openFailures.set(count);
    }

    private void broadcast(String conversationId, SubscriptionEvent event) {
        for (Channel ch : channels) {
            if (!ch.open) {
                channels.remove(ch);
            } else if (ch.conversationId.equals(conversationId)) {
                ch.pub.submit(event);
            }
        }
    }

    private static boolean consume(AtomicInteger counter) {
        return counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    private static final class ConversationLog {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<RawMessage> rows = new ArrayList<>();

        void append(RawMessage raw) {
            lock.lock();
            try {
                rows.add(raw);
            } finally {
                lock.unlock();
            }
        }

        List<RawMessage> recent(int limit) {
            lock.lock();
            try {
                List<RawMessage> out = new ArrayList<>(Math.min(limit, rows.size()));
                for (int i = rows.size() - 1; i >= 0 && out.size() < limit; i--) {
                    out.add(rows.get(i));
                }
                return out;
            } finally {
                lock.unlock();
            }
        }
    }

    private static final class Channel {
        private final String conversationId;
        private final SubmissionPublisher<SubscriptionEvent> pub;
        private volatile boolean open = true;

        private Channel(String conversationId, SubmissionPublisher<SubscriptionEvent> pub) {
            this.conversationId = conversationId;
            this.pub = pub;
        }
    }

    /**
     * Marks the channel closed when the downstream subscriber cancels.
     */
    private static final class ChannelSubscriber implements Flow.Subscriber<SubscriptionEvent> {
        private final Channel channel;
        private final Flow.Subscriber<? super SubscriptionEvent> downstream;

        private ChannelSubscriber(Channel channel, Flow.Subscriber<? super SubscriptionEvent> downstream) {
            this.channel = channel;
            this.downstream = downstream;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            downstream.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    channel.open = false;
                    subscription.cancel();
                }
            });
        }

        @Override
        public void onNext(SubscriptionEvent item) {
            downstream.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            channel.open = false;
            downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            channel.open = false;
            downstream.onComplete();
        }
    }
}
