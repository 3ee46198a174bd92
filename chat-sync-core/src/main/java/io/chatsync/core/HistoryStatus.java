package io.chatsync.core;

/**
 * Progress of the historical fetch for one conversation session.
 */
public enum HistoryStatus {
    /** No load was requested yet. */
    IDLE,

    /** A fetch is in flight. */
    LOADING,

    /** At least one fetch completed successfully. */
    LOADED,

    /** The last fetch failed; a manual refresh may be offered. */
    FAILED
}
