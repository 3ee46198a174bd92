package io.chatsync.client.reactor;

import io.chatsync.client.SyncEngine;
import io.chatsync.core.ChatSyncException;
import io.chatsync.core.ConnectionState;
import io.chatsync.core.ConversationView;
import io.chatsync.core.HistoryStatus;
import io.chatsync.core.SyncSignal;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reactor adapter over {@link SyncEngine}.
 *
 * <p>State streams start with the current value and then emit the latest value after each change
 * signal; rapid successive changes may be coalesced. Every stream completes when the engine stops.
 */
public final class ReactorSyncEngine {

    private final SyncEngine delegate;

    public ReactorSyncEngine(SyncEngine delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public SyncEngine delegate() {
        return delegate;
    }

    public Flux<SyncSignal> signals() {
        return FlowInterop.flux(delegate.signals());
    }

    public Flux<ConversationView> views() {
        // snapshots are cached by the store, so an unchanged view is the same instance
        return state(SyncSignal.VIEW_CHANGED, delegate::currentView)
                .distinctUntilChanged(Function.identity(), (a, b) -> a == b);
    }

    public Flux<ConnectionState> connectionStates() {
        return state(SyncSignal.CONNECTION_CHANGED, delegate::connectionState).distinctUntilChanged();
    }

    public Flux<HistoryStatus> historyStatuses() {
        return state(SyncSignal.HISTORY_CHANGED, delegate::historyStatus).distinctUntilChanged();
    }

    public Flux<ChatSyncException> errors() {
        return FlowInterop.flux(delegate.errors());
    }

    /**
     * Subscribes to the change signals before reading the current value, so a change made while
     * the first value is delivered is not lost. Reads and emissions share one lock, which keeps
     * emissions in read order.
     */
    private <T> Flux<T> state(SyncSignal kind, Supplier<T> read) {
        return Flux.create(sink -> {
            Object emitting = new Object();
            Disposable changes = signals()
                    .filter(signal -> signal == kind)
                    .subscribe(signal -> {
                        synchronized (emitting) {
                            sink.next(read.get());
                        }
                    }, sink::error, sink::complete);
            sink.onDispose(changes);
            synchronized (emitting) {
                sink.next(read.get());
            }
        });
    }
}
