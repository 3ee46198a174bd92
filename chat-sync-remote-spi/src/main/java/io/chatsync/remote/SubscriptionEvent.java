package io.chatsync.remote;

import java.util.Objects;

/**
 * Events emitted by a {@link RemoteSubscription}.
 */
public sealed interface SubscriptionEvent permits SubscriptionEvent.StatusChanged, SubscriptionEvent.RowInserted {

    /**
     * The channel changed status.
     *
     * @param status the new status
     */
    record StatusChanged(ChannelStatus status) implements SubscriptionEvent {
        public StatusChanged {
            Objects.requireNonNull(status, "status");
        }
    }

    /**
     * A row was inserted into the subscribed conversation.
     *
     * @param row the raw row
     */
    record RowInserted(RawMessage row) implements SubscriptionEvent {
        public RowInserted {
            Objects.requireNonNull(row, "row");
        }
    }
}
