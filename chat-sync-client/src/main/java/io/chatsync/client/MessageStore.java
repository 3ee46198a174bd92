package io.chatsync.client;

import io.chatsync.core.ConversationView;
import io.chatsync.core.Message;
import io.chatsync.core.PendingSend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for one open conversation: confirmed messages keyed by id plus the
 * viewer's pending sends.
 *
 * <p>Every mutation is serialized by one lock and the change callback runs after the lock is
 * released, so a listener may read {@link #snapshot()} without deadlocking. Once {@link #close()}
 * has been called every mutation is ignored and returns {@code false}.
 *
 * <p>Confirmed messages and pending sends are reconciled by {@link #reconcile(Message, String)}.
 * A send confirmation carries the pending token and settles exactly that entry. A live echo has
 * no token, so it claims the oldest in-flight send with the same sender and content. The claim is
 * remembered: when the send path later confirms a different message for the claimed token, or
 * fails it, the claim moves to another matching send or the claimed entry is reinstated.
 */
public final class MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    /**
     * Tolerated difference between the client clock stamping sends and the server clock stamping
     * messages.
     */
    static final Duration HISTORY_CLOCK_SKEW = Duration.ofSeconds(5);

    private static final Comparator<Slot<?>> ORDER =
            Comparator.<Slot<?>, Instant>comparing(Slot::time).thenComparingLong(Slot::seq);

    private final ReentrantLock lock = new ReentrantLock();
    private final String conversationId;
    private final String viewerId;
    private final Runnable onChange;

    private final Map<String, Slot<Message>> confirmed = new HashMap<>();
    private final Map<String, Slot<PendingSend>> pending = new LinkedHashMap<>();
    // live echoes that settled a pending send: message id -> claimed send, and the reverse index
    private final Map<String, Slot<PendingSend>> claimsByMessageId = new HashMap<>();
    private final Map<String, String> claimedMessageByToken = new HashMap<>();

    private long sequence;
    private boolean seeded;
    private boolean closed;
    private boolean dirty;
    private ConversationView view = ConversationView.empty();

    /**
     * @param conversationId conversation this store holds
     * @param viewerId       signed-in user, used to flag own entries; may be {@code null}
     * @param onChange       invoked after every state change, outside the lock
     */
    public MessageStore(String conversationId, String viewerId, Runnable onChange) {
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.viewerId = viewerId;
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    public String conversationId() {
        return conversationId;
    }

    /**
     * Installs the initial history. Applied only by the first call, and only while no confirmed
     * message has arrived through another path.
     *
     * @return whether the seed was applied
     */
    public boolean seed(List<Message> initial) {
        Objects.requireNonNull(initial, "initial");
        initial.forEach(this::checkConversation);
        boolean applied;
        lock.lock();
        try {
            if (closed || seeded || !confirmed.isEmpty()) {
                applied = false;
            } else {
                seeded = true;
                for (Message m : initial) {
                    insert(m);
                }
                dirty = true;
                applied = true;
            }
        } finally {
            lock.unlock();
        }
        if (applied) {
            log.debug("Seeded conversation {} with {} messages", conversationId, initial.size());
            onChange.run();
        } else {
            log.debug("Seed for conversation {} rejected", conversationId);
        }
        return applied;
    }

    /**
     * Adds a confirmed message unless one with the same id is already present.
     *
     * @return whether the store changed
     */
    public boolean merge(Message message) {
        checkConversation(message);
        boolean changed;
        lock.lock();
        try {
            changed = !closed && insert(message);
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    /**
     * Merges a confirmed message and removes the pending send it settles.
     *
     * @param message confirmed message
     * @param token   pending token when the message is a send confirmation, {@code null} for
     *                messages from the live feed or a history refresh
     * @return whether the store changed
     */
    public boolean reconcile(Message message, String token) {
        checkConversation(message);
        boolean changed;
        lock.lock();
        try {
            if (closed) {
                changed = false;
            } else {
                boolean added = insert(message);
                if (token != null) {
                    changed = settle(token, message) | added;
                } else {
                    if (added) claim(message);
                    changed = added;
                }
            }
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    /**
     * Merges a message read from a history page. Such a row settles an in-flight send only when it
     * was created no earlier than {@link #HISTORY_CLOCK_SKEW} before the send was submitted, so an
     * older message with the same text does not hide a send that is still on its way.
     *
     * @return whether the store changed
     */
    public boolean reconcileHistory(Message message) {
        checkConversation(message);
        boolean changed;
        lock.lock();
        try {
            changed = !closed && insert(message);
            if (changed) claim(message, message.createdAt().plus(HISTORY_CLOCK_SKEW));
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    public void addPending(PendingSend send) {
        Objects.requireNonNull(send, "send");
        if (!send.conversationId().equals(conversationId)) {
            throw new IllegalArgumentException("Pending send for conversation " + send.conversationId()
                    + " does not belong to " + conversationId);
        }
        boolean changed;
        lock.lock();
        try {
            changed = !closed && !pending.containsKey(send.token());
            if (changed) {
                pending.put(send.token(), new Slot<>(send, send.submittedAt(), sequence++));
                dirty = true;
            }
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
    }

    /**
     * Moves a pending send to {@code FAILED}. A send whose echo was already claimed is reinstated,
     * and the echo is handed to another matching in-flight send when there is one.
     */
    public boolean markFailed(String token, String reason) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(reason, "reason");
        boolean changed = false;
        lock.lock();
        try {
            if (!closed) {
                Slot<PendingSend> slot = pending.get(token);
                if (slot != null) {
                    pending.put(token, slot.with(slot.value().failed(reason)));
                    changed = true;
                } else {
                    Slot<PendingSend> released = releaseClaim(token);
                    if (released != null) {
                        pending.put(token, released.with(released.value().failed(reason)));
                        changed = true;
                    }
                }
                dirty |= changed;
            }
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    /**
     * Moves a failed send back to {@code IN_FLIGHT} for a retry.
     */
    public boolean markInFlight(String token) {
        Objects.requireNonNull(token, "token");
        boolean changed = false;
        lock.lock();
        try {
            Slot<PendingSend> slot = closed ? null : pending.get(token);
            if (slot != null && slot.value().isFailed()) {
                pending.put(token, slot.with(slot.value().inFlight()));
                dirty = true;
                changed = true;
            }
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    /**
     * Removes a failed send. In-flight sends cannot be discarded.
     */
    public boolean discard(String token) {
        Objects.requireNonNull(token, "token");
        boolean changed = false;
        lock.lock();
        try {
            Slot<PendingSend> slot = closed ? null : pending.get(token);
            if (slot != null && slot.value().isFailed()) {
                pending.remove(token);
                dirty = true;
                changed = true;
            }
        } finally {
            lock.unlock();
        }
        if (changed) onChange.run();
        return changed;
    }

    public Optional<PendingSend> pending(String token) {
        lock.lock();
        try {
            Slot<PendingSend> slot = pending.get(token);
            return slot == null ? Optional.empty() : Optional.of(slot.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current transcript. Rebuilt only after a mutation; repeated calls return the same instance.
     */
    public ConversationView snapshot() {
        lock.lock();
        try {
            if (dirty) {
                view = build();
                dirty = false;
            }
            return view;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Destroys the store. Later mutations are ignored and {@link #snapshot()} returns an empty view.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            confirmed.clear();
            pending.clear();
            claimsByMessageId.clear();
            claimedMessageByToken.clear();
            view = ConversationView.empty();
            dirty = false;
        } finally {
            lock.unlock();
        }
        log.debug("Closed store for conversation {}", conversationId);
    }

    private void checkConversation(Message message) {
        Objects.requireNonNull(message, "message");
        if (!message.conversationId().equals(conversationId)) {
            throw new IllegalArgumentException("Message " + message.id() + " belongs to conversation "
                    + message.conversationId() + ", not " + conversationId);
        }
    }

    // --- guarded by lock ---

    private boolean insert(Message message) {
        if (confirmed.containsKey(message.id())) return false;
        confirmed.put(message.id(), new Slot<>(message, message.createdAt(), sequence++));
        dirty = true;
        return true;
    }

    private boolean settle(String token, Message message) {
        boolean changed = pending.remove(token) != null;

        // an earlier echo of a different message may have settled this send
        String echoId = claimedMessageByToken.remove(token);
        if (echoId != null) claimsByMessageId.remove(echoId);

        // the echo of this message may have settled another send, which is still outstanding
        Slot<PendingSend> wronglySettled = claimsByMessageId.remove(message.id());
        if (wronglySettled != null) {
            String other = wronglySettled.value().token();
            claimedMessageByToken.remove(other);
            pending.put(other, wronglySettled);
            log.debug("Reinstating send {} settled by the echo of message {}", other, message.id());
            changed = true;
        }

        if (echoId != null && !echoId.equals(message.id())) {
            Slot<Message> echo = confirmed.get(echoId);
            if (echo != null && claim(echo.value())) changed = true;
        }
        dirty |= changed;
        return changed;
    }

    private boolean claim(Message message) {
        return claim(message, Instant.MAX);
    }

    /**
     * @param submittedUntil latest submission time of a send the message may settle
     */
    private boolean claim(Message message, Instant submittedUntil) {
        Slot<PendingSend> match = oldestMatching(message, submittedUntil);
        if (match == null) return false;
        String token = match.value().token();
        pending.remove(token);
        claimsByMessageId.put(message.id(), match);
        claimedMessageByToken.put(token, message.id());
        dirty = true;
        log.debug("Message {} settled pending send {}", message.id(), token);
        return true;
    }

    private Slot<PendingSend> releaseClaim(String token) {
        String messageId = claimedMessageByToken.remove(token);
        if (messageId == null) return null;
        Slot<PendingSend> released = claimsByMessageId.remove(messageId);
        Slot<Message> echo = confirmed.get(messageId);
        if (echo != null) claim(echo.value());
        return released;
    }

    private Slot<PendingSend> oldestMatching(Message message, Instant submittedUntil) {
        Slot<PendingSend> best = null;
        for (Slot<PendingSend> slot : pending.values()) {
            PendingSend p = slot.value();
            if (p.isFailed() || !p.matches(message) || p.submittedAt().isAfter(submittedUntil)) continue;
            if (best == null || ORDER.compare(slot, best) < 0) best = slot;
        }
        return best;
    }

    private ConversationView build() {
        List<Slot<?>> slots = new ArrayList<>(confirmed.size() + pending.size());
        slots.addAll(confirmed.values());
        slots.addAll(pending.values());
        slots.sort(ORDER);
        List<ConversationView.Entry> entries = new ArrayList<>(slots.size());
        for (Slot<?> slot : slots) {
            Object value = slot.value();
            if (value instanceof Message m) {
                entries.add(new ConversationView.Confirmed(m, m.sentBy(viewerId)));
            } else {
                PendingSend p = (PendingSend) value;
                entries.add(new ConversationView.Pending(p, p.senderId().equals(viewerId)));
            }
        }
        return new ConversationView(entries);
    }

    /**
     * A stored value with its ordering key; {@code seq} is arrival order and breaks timestamp ties.
     */
    private record Slot<T>(T value, Instant time, long seq) {
        Slot<T> with(T replacement) {
            return new Slot<>(replacement, time, seq);
        }
    }
}
