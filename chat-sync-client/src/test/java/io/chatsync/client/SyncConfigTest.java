package io.chatsync.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        SyncConfig config = SyncConfig.defaults();

        assertThat(config.historyLimit()).isEqualTo(50);
        assertThat(config.reconnectInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.reconnectMultiplier()).isEqualTo(2.0);
        assertThat(config.reconnectMaxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.reconnectJitter()).isZero();
        assertThat(config.maxReconnectAttempts()).isEqualTo(10);
        assertThat(config.catchUpOnResubscribe()).isTrue();
    }

    @Test
    void readsChatSyncProperties() {
        Properties props = new Properties();
        props.setProperty("chat-sync.history.limit", "20");
        props.setProperty("chat-sync.reconnect.initial-delay-ms", "250");
        props.setProperty("chat-sync.reconnect.max-delay-ms", " 5000 ");
        props.setProperty("chat-sync.reconnect.max-attempts", "0");
        props.setProperty("chat-sync.reconnect.catch-up", "false");
        props.setProperty("unrelated.key", "ignored");

        SyncConfig config = SyncConfig.fromProperties(props);

        assertThat(config.historyLimit()).isEqualTo(20);
        assertThat(config.reconnectInitialDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.reconnectMaxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.reconnectMultiplier()).isEqualTo(2.0);
        assertThat(config.maxReconnectAttempts()).isZero();
        assertThat(config.catchUpOnResubscribe()).isFalse();
    }

    @Test
    void loadsFromClasspathResource() {
        SyncConfig config = SyncConfig.load("chat-sync-test.properties");

        assertThat(config.historyLimit()).isEqualTo(25);
        assertThat(config.reconnectMultiplier()).isEqualTo(1.5);
        assertThat(config.reconnectJitter()).isEqualTo(0.2);
    }

    @Test
    void missingResourceFallsBackToDefaults() {
        assertThat(SyncConfig.load("no-such-file.properties").historyLimit()).isEqualTo(50);
    }

    @Test
    void rejectsMalformedValues() {
        Properties props = new Properties();
        props.setProperty("chat-sync.history.limit", "fifty");

        assertThatThrownBy(() -> SyncConfig.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chat-sync.history.limit");
    }

    @Test
    void rejectsInconsistentBackoff() {
        assertThatThrownBy(() -> SyncConfig.builder()
                .reconnectInitialDelay(Duration.ofSeconds(10))
                .reconnectMaxDelay(Duration.ofSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SyncConfig.builder().historyLimit(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
