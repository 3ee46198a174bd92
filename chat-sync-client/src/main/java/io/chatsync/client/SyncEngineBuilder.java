package io.chatsync.client;

import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.MessageDecoders;
import io.chatsync.remote.RemoteAppend;
import io.chatsync.remote.RemoteHistoryQuery;
import io.chatsync.remote.RemoteSubscription;
import io.chatsync.remote.SessionProvider;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;

public final class SyncEngineBuilder {
    RemoteHistoryQuery historyQuery;
    RemoteAppend append;
    RemoteSubscription subscription;
    MessageDecoder decoder;
    SessionProvider session;
    SyncConfig config;
    Clock clock = Clock.systemUTC();
    Executor ioExecutor;
    ScheduledExecutorService scheduler;
    Executor signalExecutor = ForkJoinPool.commonPool();

    SyncEngineBuilder() {}

    /**
     * Uses one backend for history, sends and the live subscription.
     */
    public <R extends RemoteHistoryQuery & RemoteAppend & RemoteSubscription> SyncEngineBuilder remoteStore(R store) {
        Objects.requireNonNull(store, "store");
        this.historyQuery = store;
        this.append = store;
        this.subscription = store;
        return this;
    }

    public SyncEngineBuilder historyQuery(RemoteHistoryQuery historyQuery) {
        this.historyQuery = Objects.requireNonNull(historyQuery, "historyQuery");
        return this;
    }

    public SyncEngineBuilder append(RemoteAppend append) {
        this.append = Objects.requireNonNull(append, "append");
        return this;
    }

    public SyncEngineBuilder subscription(RemoteSubscription subscription) {
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        return this;
    }

    public SyncEngineBuilder decoder(MessageDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        return this;
    }

    public SyncEngineBuilder session(SessionProvider session) {
        this.session = Objects.requireNonNull(session, "session");
        return this;
    }

    public SyncEngineBuilder config(SyncConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public SyncEngineBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Executor for history loads and sends. Not shut down by the engine. When unset the engine
     * owns a pool of daemon threads.
     */
    public SyncEngineBuilder ioExecutor(Executor ioExecutor) {
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        return this;
    }

    /**
     * Scheduler for reconnect timers. Not shut down by the engine. When unset the engine owns a
     * single daemon thread.
     */
    public SyncEngineBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        return this;
    }

    /**
     * Executor delivering {@link SyncEngine#signals()} and {@link SyncEngine#errors()}.
     */
    public SyncEngineBuilder signalExecutor(Executor signalExecutor) {
        this.signalExecutor = Objects.requireNonNull(signalExecutor, "signalExecutor");
        return this;
    }

    /**
     * @throws IllegalStateException if a remote collaborator or the session is missing, or no
     *                               decoder is set and none is installed
     */
    public SyncEngine build() {
        if (historyQuery == null) throw new IllegalStateException("historyQuery must be set");
        if (append == null) throw new IllegalStateException("append must be set");
        if (subscription == null) throw new IllegalStateException("subscription must be set");
        if (session == null) throw new IllegalStateException("session must be set");
        if (decoder == null) decoder = MessageDecoders.load();
        if (config == null) config = SyncConfig.load();
        return new SyncEngine(this);
    }
}
