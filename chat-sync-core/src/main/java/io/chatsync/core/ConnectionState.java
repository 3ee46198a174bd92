package io.chatsync.core;

import java.util.Objects;

/**
 * Connectivity of the live message feed, as shown by a connectivity indicator.
 *
 * <p>Transitions:
 * <pre>
 * Disconnected -> Connecting -> Subscribed
 * Connecting | Subscribed -> Degraded -> Reconnecting -> Connecting
 * any -> Disconnected (teardown, terminal)
 * </pre>
 */
public sealed interface ConnectionState
        permits ConnectionState.Disconnected, ConnectionState.Connecting, ConnectionState.Subscribed,
        ConnectionState.Degraded, ConnectionState.Reconnecting {

    Disconnected DISCONNECTED = new Disconnected();
    Connecting CONNECTING = new Connecting();
    Subscribed SUBSCRIBED = new Subscribed();

    /**
     * Whether live events are currently flowing.
     */
    default boolean isLive() {
        return this instanceof Subscribed;
    }

    /**
     * Not connected: either not started yet or torn down.
     */
    record Disconnected() implements ConnectionState {}

    /**
     * The subscription was opened and waits for the server to acknowledge it.
     */
    record Connecting() implements ConnectionState {}

    /**
     * The subscription is acknowledged and delivering events.
     */
    record Subscribed() implements ConnectionState {}

    /**
     * The subscription failed or was closed by the remote side.
     *
     * @param reason short description of the failure
     * @param exhausted {@code true} when the reconnect ceiling was reached and no further attempt
     *                  is scheduled (the "offline" state)
     */
    record Degraded(String reason, boolean exhausted) implements ConnectionState {
        public Degraded {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * A reconnect attempt is being started.
     *
     * @param attempt 1-based number of consecutive attempts since the last successful subscribe
     */
    record Reconnecting(int attempt) implements ConnectionState {
        public Reconnecting {
            if (attempt < 1) {
                throw new IllegalArgumentException("attempt must be positive");
            }
        }
    }
}
