/**
 * Contracts of the remote collaborators the engine talks to.
 *
 * <p>The managed backend is seen through three small capabilities: a history query
 * ({@link io.chatsync.remote.RemoteHistoryQuery}), an append operation
 * ({@link io.chatsync.remote.RemoteAppend}) and a row-insert subscription
 * ({@link io.chatsync.remote.RemoteSubscription}). Rows cross this boundary undecoded as
 * {@link io.chatsync.remote.RawMessage}; a {@link io.chatsync.remote.MessageDecoder} turns them into
 * messages.
 *
 * <p>{@link io.chatsync.remote.InMemoryRemoteStore} implements all three for tests and examples.
 */
package io.chatsync.remote;
