/**
 * The synchronization engine: {@link io.chatsync.client.SyncEngine} and the components it wires
 * together.
 */
package io.chatsync.client;
