package io.chatsync.remote;

/**
 * Appends a message to a conversation.
 */
@FunctionalInterface
public interface RemoteAppend {

    /**
     * Inserts a message. The server assigns id and timestamp.
     *
     * @return the inserted row as stored by the server
     * @throws RemoteStoreException if the insert is rejected or the call fails
     */
    RawMessage insert(String conversationId, String senderId, String content) throws RemoteStoreException;
}
