package io.chatsync.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionStateTest {

    @Test
    void onlySubscribedIsLive() {
        assertThat(ConnectionState.SUBSCRIBED.isLive()).isTrue();
        assertThat(ConnectionState.CONNECTING.isLive()).isFalse();
        assertThat(new ConnectionState.Degraded("closed", false).isLive()).isFalse();
        assertThat(new ConnectionState.Reconnecting(1).isLive()).isFalse();
    }

    @Test
    void reconnectingRequiresPositiveAttempt() {
        assertThatThrownBy(() -> new ConnectionState.Reconnecting(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
