package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.Message;
import io.chatsync.remote.MessageDecodeException;
import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteHistoryQuery;
import io.chatsync.remote.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches the most recent page of a conversation.
 *
 * <p>The remote returns rows newest first; the loaded list is ascending by timestamp, with rows
 * that share a timestamp kept in server order. Failures complete the future with
 * {@link ChatSyncException.FetchFailed}. Nothing is retried here.
 */
public final class HistoryLoader {

    private static final Logger log = LoggerFactory.getLogger(HistoryLoader.class);

    private final RemoteHistoryQuery remote;
    private final MessageDecoder decoder;
    private final Executor executor;

    public HistoryLoader(RemoteHistoryQuery remote, MessageDecoder decoder, Executor executor) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<List<Message>> load(String conversationId, int limit) {
        Objects.requireNonNull(conversationId, "conversationId");
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        return CompletableFuture.supplyAsync(() -> fetch(conversationId, limit), executor);
    }

    private List<Message> fetch(String conversationId, int limit) {
        log.debug("Loading up to {} messages of conversation {}", limit, conversationId);
        List<RawMessage> rows;
        try {
            rows = remote.fetchRecent(conversationId, limit);
        } catch (RemoteStoreException e) {
            log.warn("History query for conversation {} failed: {}", conversationId, e.getMessage());
            throw new ChatSyncException.FetchFailed(Failures.fetch(e), e);
        }

        List<Message> messages = new ArrayList<>(rows.size());
        for (RawMessage raw : rows) {
            Message m;
            try {
                m = decoder.decode(raw);
            } catch (MessageDecodeException e) {
                throw new ChatSyncException.FetchFailed("Error loading messages: " + e.getMessage(),
                        new ChatSyncException.DecodeFailed(e.getMessage(), e));
            }
            if (!m.conversationId().equals(conversationId)) {
                log.warn("Ignoring message {} of conversation {} in history of {}", m.id(), m.conversationId(), conversationId);
                continue;
            }
            messages.add(m);
        }
        Collections.reverse(messages);
        messages.sort(Comparator.comparing(Message::createdAt));
        log.debug("Loaded {} messages of conversation {}", messages.size(), conversationId);
        return List.copyOf(messages);
    }
}
