package io.chatsync.core;

/**
 * "Something changed" notifications pushed to presentation code, which then pulls the new state.
 */
public enum SyncSignal {
    VIEW_CHANGED,
    CONNECTION_CHANGED,
    HISTORY_CHANGED
}
