package io.chatsync.client.reactor;

import org.reactivestreams.FlowAdapters;
import reactor.core.publisher.Flux;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Lifts the engine's {@link Flow} publishers into Reactor.
 */
final class FlowInterop {
    private FlowInterop() {}

    static <T> Flux<T> flux(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return Flux.from(FlowAdapters.toPublisher(publisher));
    }
}
