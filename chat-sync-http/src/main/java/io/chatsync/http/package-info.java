/**
 * HTTP adapters of the remote seams: {@link io.chatsync.http.RestRemoteStore} for history and
 * appends against a PostgREST-style table, {@link io.chatsync.http.SseRemoteSubscription} for live
 * inserts over server-sent events.
 */
package io.chatsync.http;
