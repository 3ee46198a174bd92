package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.ConnectionState;
import io.chatsync.core.ConversationView;
import io.chatsync.core.HistoryStatus;
import io.chatsync.core.Message;
import io.chatsync.core.SyncSignal;
import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.RemoteAppend;
import io.chatsync.remote.RemoteHistoryQuery;
import io.chatsync.remote.RemoteSubscription;
import io.chatsync.remote.SessionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the transcript of one conversation in sync: initial history, live inserts, optimistic
 * sends and reconnects.
 *
 * <pre>{@code
 * SyncEngine engine = SyncEngine.builder()
 *         .remoteStore(store)
 *         .session(() -> currentUser)
 *         .build();
 * engine.signals().subscribe(subscriber);
 * engine.start("group-1");
 * engine.send("hello");
 * ...
 * engine.stop();
 * }</pre>
 *
 * <p>An engine serves a single conversation and a single {@link #start(String)}. Reads never block;
 * changes are announced on {@link #signals()} and fetch or send failures on {@link #errors()}.
 * After {@link #stop()} no work is left running and late results are discarded.
 */
public final class SyncEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private enum LoadKind { INITIAL, REFRESH, CATCH_UP }

    private final RemoteHistoryQuery historyQuery;
    private final RemoteAppend append;
    private final RemoteSubscription subscription;
    private final MessageDecoder decoder;
    private final SessionProvider session;
    private final SyncConfig config;
    private final Clock clock;
    private final Executor suppliedIo;
    private final ScheduledExecutorService suppliedScheduler;

    private final SubmissionPublisher<SyncSignal> signals;
    private final SubmissionPublisher<ChatSyncException> errors;
    private final AtomicReference<ChatSyncException> lastError = new AtomicReference<>();
    private final Object lifecycle = new Object();

    private volatile HistoryStatus historyStatus = HistoryStatus.IDLE;
    private volatile boolean started;
    private volatile boolean stopped;

    private volatile String conversationId;
    private volatile MessageStore store;
    private volatile ConnectionSupervisor supervisor;
    private volatile SendCoordinator sender;
    private volatile CompletableFuture<?> historyLoad;
    private ExecutorService ownedIo;
    private ScheduledExecutorService ownedScheduler;

    SyncEngine(SyncEngineBuilder b) {
        this.historyQuery = b.historyQuery;
        this.append = b.append;
        this.subscription = b.subscription;
        this.decoder = b.decoder;
        this.session = b.session;
        this.config = b.config;
        this.clock = b.clock;
        this.suppliedIo = b.ioExecutor;
        this.suppliedScheduler = b.scheduler;
        this.signals = new SubmissionPublisher<>(b.signalExecutor, Flow.defaultBufferSize());
        this.errors = new SubmissionPublisher<>(b.signalExecutor, Flow.defaultBufferSize());
    }

    public static SyncEngineBuilder builder() {
        return new SyncEngineBuilder();
    }

    /**
     * Opens a conversation: loads its history, then subscribes to live inserts.
     *
     * @throws IllegalStateException if the engine was already started or stopped
     */
    public void start(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        CompletableFuture<?> initial;
        synchronized (lifecycle) {
            if (stopped) throw new IllegalStateException("Engine was stopped");
            if (started) throw new IllegalStateException("Engine already started for conversation " + this.conversationId);

            Executor io = suppliedIo;
            if (io == null) {
                ownedIo = Executors.newCachedThreadPool(new SyncThreads("chat-sync-io"));
                io = ownedIo;
            }
            ScheduledExecutorService scheduler = suppliedScheduler;
            if (scheduler == null) {
                ownedScheduler = Executors.newSingleThreadScheduledExecutor(new SyncThreads("chat-sync-reconnect"));
                scheduler = ownedScheduler;
            }

            String viewerId = session.currentUserId();
            MessageStore s = new MessageStore(conversationId, viewerId, () -> signal(SyncSignal.VIEW_CHANGED));
            this.conversationId = conversationId;
            this.store = s;
            this.sender = new SendCoordinator(s, append, decoder, session, io, clock, this::report);
            this.supervisor = new ConnectionSupervisor(
                    new LiveFeed(subscription, decoder, conversationId),
                    scheduler, config.backoff(), config.maxReconnectAttempts(), new LiveObserver(s));
            log.debug("Starting conversation {} for user {} with {}", conversationId, viewerId, config);
            started = true;
            initial = loadHistory(LoadKind.INITIAL, io);
        }
        initial.whenComplete((ignored, error) -> connect());
    }

    /**
     * Tears everything down. Idempotent.
     */
    public void stop() {
        synchronized (lifecycle) {
            if (stopped) return;
            stopped = true;
        }
        if (supervisor != null) supervisor.disconnect();
        CompletableFuture<?> load = historyLoad;
        if (load != null) load.cancel(true);
        if (sender != null) sender.cancelAll();
        if (store != null) store.close();
        if (ownedIo != null) ownedIo.shutdownNow();
        if (ownedScheduler != null) ownedScheduler.shutdownNow();
        signals.close();
        errors.close();
        log.debug("Stopped conversation {}", conversationId);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return started && !stopped;
    }

    public Optional<String> conversationId() {
        return Optional.ofNullable(conversationId);
    }

    public ConversationView currentView() {
        MessageStore s = store;
        return s == null ? ConversationView.empty() : s.snapshot();
    }

    public ConnectionState connectionState() {
        ConnectionSupervisor s = supervisor;
        return s == null || stopped ? ConnectionState.DISCONNECTED : s.state();
    }

    public HistoryStatus historyStatus() {
        return historyStatus;
    }

    public Optional<ChatSyncException> lastError() {
        return Optional.ofNullable(lastError.get());
    }

    public void clearError() {
        lastError.set(null);
    }

    /**
     * Sends a message optimistically.
     *
     * @return the pending token, or empty when nothing was sent
     */
    public Optional<String> send(String content) {
        requireStarted();
        if (stopped) return Optional.empty();
        return sender.send(content);
    }

    public boolean retryFailed(String token) {
        requireStarted();
        return !stopped && sender.retryFailed(token);
    }

    public boolean discardFailed(String token) {
        requireStarted();
        return !stopped && sender.discardFailed(token);
    }

    /**
     * Reloads the latest history page and merges it into the transcript.
     */
    public void refresh() {
        requireStarted();
        if (stopped) return;
        loadHistory(LoadKind.REFRESH, io());
    }

    public boolean reconnectNow() {
        requireStarted();
        return !stopped && supervisor.reconnectNow();
    }

    /**
     * Change notifications. Subscribers re-read the engine state they care about.
     */
    public Flow.Publisher<SyncSignal> signals() {
        return signals;
    }

    /**
     * Fetch and send failures, each delivered once.
     */
    public Flow.Publisher<ChatSyncException> errors() {
        return errors;
    }

    private void requireStarted() {
        if (!started) throw new IllegalStateException("Engine not started");
    }

    private Executor io() {
        return suppliedIo != null ? suppliedIo : ownedIo;
    }

    private CompletableFuture<?> loadHistory(LoadKind kind, Executor io) {
        if (kind != LoadKind.CATCH_UP) setHistoryStatus(HistoryStatus.LOADING);
        MessageStore s = store;
        CompletableFuture<List<Message>> load;
        try {
            load = new HistoryLoader(historyQuery, decoder, io).load(conversationId, config.historyLimit());
        } catch (RuntimeException e) {
            load = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<?> settled = load.handle((messages, error) -> {
            if (stopped) return null;
            if (error != null) {
                onHistoryFailed(kind, error);
            } else {
                apply(s, kind, messages);
            }
            return null;
        });
        historyLoad = load;
        return settled;
    }

    private void apply(MessageStore s, LoadKind kind, List<Message> messages) {
        if (kind != LoadKind.INITIAL || !s.seed(messages)) {
            for (Message m : messages) {
                s.reconcileHistory(m);
            }
        }
        log.debug("Applied {} history messages to conversation {} ({})", messages.size(), conversationId, kind);
        setHistoryStatus(HistoryStatus.LOADED);
    }

    private void onHistoryFailed(LoadKind kind, Throwable error) {
        if (Failures.isCancellation(error)) return;
        ChatSyncException failure = Failures.asFetchFailed(error);
        if (kind == LoadKind.CATCH_UP) {
            log.warn("Catch-up of conversation {} failed: {}", conversationId, failure.getMessage());
            return;
        }
        setHistoryStatus(HistoryStatus.FAILED);
        report(failure);
    }

    private void connect() {
        synchronized (lifecycle) {
            if (stopped) return;
            supervisor.connect();
        }
    }

    private void catchUp() {
        if (!config.catchUpOnResubscribe() || stopped) return;
        log.debug("Catching up conversation {} after reconnect", conversationId);
        loadHistory(LoadKind.CATCH_UP, io());
    }

    private void setHistoryStatus(HistoryStatus status) {
        if (historyStatus == status) return;
        historyStatus = status;
        signal(SyncSignal.HISTORY_CHANGED);
    }

    private void report(ChatSyncException error) {
        if (stopped) return;
        lastError.set(error);
        publish(errors, error);
    }

    private void signal(SyncSignal signal) {
        publish(signals, signal);
    }

    private <T> void publish(SubmissionPublisher<T> publisher, T item) {
        if (publisher.isClosed()) return;
        try {
            publisher.offer(item, (subscriber, dropped) -> {
                log.debug("Dropping {} for a slow subscriber", dropped);
                return false;
            });
        } catch (IllegalStateException e) {
            log.debug("Publisher closed while publishing {}", item);
        }
    }

    private final class LiveObserver implements ConnectionSupervisor.Observer {
        private final MessageStore store;

        private LiveObserver(MessageStore store) {
            this.store = store;
        }

        @Override
        public void onMessage(Message message) {
            store.reconcile(message, null);
        }

        @Override
        public void onStateChanged(ConnectionState state) {
            signal(SyncSignal.CONNECTION_CHANGED);
        }

        @Override
        public void onResubscribed() {
            catchUp();
        }
    }
}
