package io.chatsync.client;

import io.chatsync.core.ChatSyncException;
import io.chatsync.core.ConversationView;
import io.chatsync.core.Message;
import io.chatsync.core.PendingSend;
import io.chatsync.json.jackson.JacksonMessageDecoder;
import io.chatsync.remote.InMemoryRemoteStore;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteAppend;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

import static io.chatsync.client.Fixtures.ALICE;
import static io.chatsync.client.Fixtures.CONV;
import static io.chatsync.client.Fixtures.T0;
import static io.chatsync.client.Fixtures.at;
import static org.assertj.core.api.Assertions.assertThat;

class SendCoordinatorTest {

    private final Fixtures.MutableClock clock = new Fixtures.MutableClock(T0);
    private final InMemoryRemoteStore remote = new InMemoryRemoteStore(clock, Runnable::run);
    private final MessageStore store = new MessageStore(CONV, ALICE, () -> {});
    private final List<ChatSyncException> errors = new ArrayList<>();
    private final List<Runnable> queued = new ArrayList<>();
    private final Executor manual = queued::add;

    private SendCoordinator coordinator(Executor executor, String user) {
        return new SendCoordinator(store, remote, new JacksonMessageDecoder(), () -> user, executor, clock, errors::add);
    }

    private SendCoordinator coordinator(RemoteAppend append) {
        return new SendCoordinator(store, append, new JacksonMessageDecoder(), () -> ALICE, Runnable::run, clock, errors::add);
    }

    private void runQueued() {
        List<Runnable> tasks = new ArrayList<>(queued);
        queued.clear();
        tasks.forEach(Runnable::run);
    }

    @Test
    void pendingEntryAppearsBeforeTheAppendCompletes() {
        SendCoordinator sender = coordinator(manual, ALICE);

        String token = sender.send("  hello  ").orElseThrow();

        PendingSend pending = store.snapshot().find(token).orElseThrow();
        assertThat(pending.content()).isEqualTo("hello");
        assertThat(pending.status()).isEqualTo(PendingSend.Status.IN_FLIGHT);
        assertThat(pending.submittedAt()).isEqualTo(T0);
        assertThat(sender.inFlightCount()).isEqualTo(1);

        clock.advance(Duration.ofMillis(300));
        runQueued();

        ConversationView view = store.snapshot();
        assertThat(view.pending()).isEmpty();
        assertThat(view.messages()).singleElement().extracting(Message::content).isEqualTo("hello");
        assertThat(sender.inFlightCount()).isZero();
        assertThat(errors).isEmpty();
    }

    @Test
    void blankContentIsIgnored() throws Exception {
        SendCoordinator sender = coordinator(Runnable::run, ALICE);

        assertThat(sender.send("   ")).isEmpty();
        assertThat(sender.send(null)).isEmpty();

        assertThat(store.snapshot().isEmpty()).isTrue();
        assertThat(remote.fetchRecent(CONV, 10)).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void sendWithoutUserReportsAuthenticationError() throws Exception {
        SendCoordinator sender = coordinator(Runnable::run, null);

        assertThat(sender.send("hello")).isEmpty();

        assertThat(errors).singleElement().isInstanceOfSatisfying(ChatSyncException.SendFailed.class, e -> {
            assertThat(e.token()).isNull();
            assertThat(e).hasMessageContaining("Authentication error");
        });
        assertThat(store.snapshot().isEmpty()).isTrue();
        assertThat(remote.fetchRecent(CONV, 10)).isEmpty();
    }

    @Test
    void failedSendStaysVisibleAndCanBeRetried() {
        remote.failNextAppends(1);
        SendCoordinator sender = coordinator(Runnable::run, ALICE);

        String token = sender.send("hello").orElseThrow();

        PendingSend failed = store.snapshot().find(token).orElseThrow();
        assertThat(failed.isFailed()).isTrue();
        assertThat(failed.failureReason()).contains("status 503");
        assertThat(errors).singleElement().isInstanceOfSatisfying(ChatSyncException.SendFailed.class,
                e -> assertThat(e.token()).isEqualTo(token));

        assertThat(sender.retryFailed(token)).isTrue();

        ConversationView view = store.snapshot();
        assertThat(view.pending()).isEmpty();
        assertThat(view.messages()).extracting(Message::content).containsExactly("hello");
        assertThat(errors).hasSize(1);
    }

    @Test
    void retryKeepsTheOriginalPosition() {
        remote.failNextAppends(1);
        SendCoordinator sender = coordinator(manual, ALICE);
        String token = sender.send("first").orElseThrow();
        runQueued();

        clock.advance(Duration.ofSeconds(5));
        store.merge(new Message("other", CONV, "bob", "later", clock.instant()));
        sender.retryFailed(token);

        assertThat(store.snapshot().entries()).extracting(ConversationView.Entry::key).containsExactly(token, "other");
    }

    @Test
    void onlyFailedSendsCanBeRetriedOrDiscarded() {
        SendCoordinator sender = coordinator(manual, ALICE);
        String token = sender.send("hello").orElseThrow();

        assertThat(sender.retryFailed(token)).isFalse();
        assertThat(sender.discardFailed(token)).isFalse();
        assertThat(sender.retryFailed("unknown")).isFalse();
        assertThat(queued).hasSize(1);
    }

    @Test
    void discardRemovesFailedSend() {
        remote.failNextAppends(1);
        SendCoordinator sender = coordinator(Runnable::run, ALICE);
        String token = sender.send("hello").orElseThrow();

        assertThat(sender.discardFailed(token)).isTrue();

        assertThat(store.snapshot().isEmpty()).isTrue();
    }

    @Test
    void cancelledSendsNeverReachTheRemote() throws Exception {
        SendCoordinator sender = coordinator(manual, ALICE);
        sender.send("hello").orElseThrow();

        sender.cancelAll();
        runQueued();

        assertThat(remote.fetchRecent(CONV, 10)).isEmpty();
        assertThat(sender.send("again")).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void lateResultsAfterCloseAreDiscarded() throws Exception {
        remote.failNextAppends(1);
        SendCoordinator sender = coordinator(manual, ALICE);
        sender.send("doomed").orElseThrow();
        sender.send("delivered").orElseThrow();

        store.close();
        runQueued();

        assertThat(store.snapshot().isEmpty()).isTrue();
        assertThat(errors).isEmpty();
        assertThat(remote.fetchRecent(CONV, 10)).hasSize(1);
    }

    @Test
    void unreadableConfirmationLeavesTheSendForItsEcho() {
        SendCoordinator sender = coordinator((conversation, senderId, content) -> new RawMessage(Map.of("id", "x")));

        Optional<String> token = sender.send("hello");

        assertThat(store.snapshot().find(token.orElseThrow()))
                .hasValueSatisfying(p -> assertThat(p.status()).isEqualTo(PendingSend.Status.IN_FLIGHT));
        assertThat(errors).isEmpty();

        store.reconcile(new Message("x", CONV, ALICE, "hello", at(1)), null);
        assertThat(store.snapshot().pending()).isEmpty();
    }

    @Test
    void remoteBugIsReportedAsSendFailure() {
        SendCoordinator sender = coordinator((conversation, senderId, content) -> {
            throw new IllegalStateException("driver crashed");
        });

        String token = sender.send("hello").orElseThrow();

        assertThat(store.snapshot().find(token)).hasValueSatisfying(p -> assertThat(p.isFailed()).isTrue());
        assertThat(errors).singleElement().isInstanceOf(ChatSyncException.SendFailed.class);
    }
}
