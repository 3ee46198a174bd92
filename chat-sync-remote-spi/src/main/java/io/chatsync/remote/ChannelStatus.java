package io.chatsync.remote;

/**
 * Subscription status reported by the realtime channel.
 */
public enum ChannelStatus {
    /** The server acknowledged the subscription; inserts will follow. */
    SUBSCRIBED,

    /** The channel was closed by the server. */
    CLOSED,

    /** The channel reported an error. */
    CHANNEL_ERROR,

    /** The server did not acknowledge the subscription in time. */
    TIMED_OUT
}
