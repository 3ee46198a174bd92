package io.chatsync.remote;

import java.util.List;

/**
 * Fetches past messages of a conversation.
 */
@FunctionalInterface
public interface RemoteHistoryQuery {

    /**
     * Returns the most recent rows of a conversation, newest first.
     *
     * @param conversationId conversation to read
     * @param limit maximum number of rows
     * @return at most {@code limit} rows ordered by time, descending
     * @throws RemoteStoreException if the query fails
     */
    List<RawMessage> fetchRecent(String conversationId, int limit) throws RemoteStoreException;
}
