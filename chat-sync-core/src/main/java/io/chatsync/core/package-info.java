/**
 * Transport-neutral core of the chat synchronization engine.
 *
 * <p>This module contains only:
 * <ul>
 *   <li>the message model ({@link io.chatsync.core.Message}, {@link io.chatsync.core.PendingSend})</li>
 *   <li>the read model handed to presentation code ({@link io.chatsync.core.ConversationView},
 *       {@link io.chatsync.core.ConnectionState}, {@link io.chatsync.core.HistoryStatus})</li>
 *   <li>change signals and the exception taxonomy</li>
 * </ul>
 *
 * <p>Remote bindings and the engine itself live in other modules.
 */
package io.chatsync.core;
