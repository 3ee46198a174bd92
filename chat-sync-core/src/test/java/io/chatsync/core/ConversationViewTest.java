package io.chatsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationViewTest {

    private static final Instant T = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void splitsConfirmedPendingAndFailed() {
        Message m = new Message("m1", "g1", "u2", "hello", T);
        PendingSend inFlight = PendingSend.create("g1", "u1", "a", T.plusSeconds(1));
        PendingSend failed = PendingSend.create("g1", "u1", "b", T.plusSeconds(2)).failed("boom");

        ConversationView view = new ConversationView(List.of(
                new ConversationView.Confirmed(m, false),
                new ConversationView.Pending(inFlight, true),
                new ConversationView.Pending(failed, true)));

        assertThat(view.size()).isEqualTo(3);
        assertThat(view.messages()).containsExactly(m);
        assertThat(view.pending()).containsExactly(inFlight, failed);
        assertThat(view.failed()).containsExactly(failed);
        assertThat(view.contains("m1")).isTrue();
        assertThat(view.find(failed.token())).contains(failed);
        assertThat(view.entries().get(1).key()).isEqualTo(inFlight.token());
        assertThat(view.entries().get(1).effectiveTime()).isEqualTo(T.plusSeconds(1));
    }

    @Test
    void equalEntriesMakeEqualViews() {
        Message m = new Message("m1", "g1", "u2", "hello", T);

        ConversationView a = new ConversationView(List.of(new ConversationView.Confirmed(m, false)));
        ConversationView b = new ConversationView(List.of(new ConversationView.Confirmed(m, false)));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(ConversationView.empty().isEmpty()).isTrue();
    }
}
