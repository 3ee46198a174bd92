package io.chatsync.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, render-ready transcript of one conversation.
 *
 * <p>Entries are confirmed messages and pending sends, sorted by effective timestamp (server time
 * for confirmed messages, submission time for pending ones). Ties keep the order in which the
 * entries first reached the store.
 */
public final class ConversationView {

    private static final ConversationView EMPTY = new ConversationView(List.of());

    private final List<Entry> entries;

    public ConversationView(List<Entry> entries) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static ConversationView empty() {
        return EMPTY;
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Confirmed messages only, in view order.
     */
    public List<Message> messages() {
        List<Message> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e instanceof Confirmed c) out.add(c.message());
        }
        return out;
    }

    /**
     * Pending sends (in flight and failed), in view order.
     */
    public List<PendingSend> pending() {
        List<PendingSend> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e instanceof Pending p) out.add(p.send());
        }
        return out;
    }

    public List<PendingSend> failed() {
        List<PendingSend> out = new ArrayList<>();
        for (PendingSend p : pending()) {
            if (p.isFailed()) out.add(p);
        }
        return out;
    }

    public boolean contains(String messageId) {
        for (Entry e : entries) {
            if (e instanceof Confirmed c && c.message().id().equals(messageId)) return true;
        }
        return false;
    }

    public Optional<PendingSend> find(String token) {
        for (Entry e : entries) {
            if (e instanceof Pending p && p.send().token().equals(token)) return Optional.of(p.send());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ConversationView)) return false;
        return entries.equals(((ConversationView) other).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ConversationView" + entries;
    }

    /**
     * One row of the transcript.
     */
    public sealed interface Entry permits Confirmed, Pending {

        /**
         * Timestamp that governs display order.
         */
        Instant effectiveTime();

        /**
         * Stable identity for list diffing: the message id or the pending token.
         */
        String key();

        /**
         * Whether the entry was authored by the viewing user.
         */
        boolean own();
    }

    public record Confirmed(Message message, boolean own) implements Entry {
        public Confirmed {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Instant effectiveTime() {
            return message.createdAt();
        }

        @Override
        public String key() {
            return message.id();
        }
    }

    public record Pending(PendingSend send, boolean own) implements Entry {
        public Pending {
            Objects.requireNonNull(send, "send");
        }

        @Override
        public Instant effectiveTime() {
            return send.submittedAt();
        }

        @Override
        public String key() {
            return send.token();
        }
    }
}
