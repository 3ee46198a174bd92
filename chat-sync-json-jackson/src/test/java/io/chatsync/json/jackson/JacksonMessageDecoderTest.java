package io.chatsync.json.jackson;

import io.chatsync.core.Message;
import io.chatsync.remote.MessageDecodeException;
import io.chatsync.remote.MessageDecoders;
import io.chatsync.remote.RawMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonMessageDecoderTest {

    private final JacksonMessageDecoder decoder = new JacksonMessageDecoder();

    @Test
    void decodesRowWithOffsetTimestamp() throws Exception {
        Message m = decoder.decode(row(Map.of(
                "id", "8c1f",
                "group_id", "g1",
                "sender_id", "u1",
                "content", "hello",
                "timestamp", "2025-03-01T10:00:00.123456+00:00")));

        assertThat(m).isEqualTo(new Message("8c1f", "g1", "u1", "hello",
                Instant.parse("2025-03-01T10:00:00.123456Z")));
    }

    @Test
    void acceptsLegacyTextColumnAndCreatedAt() throws Exception {
        Message m = decoder.decode(row(Map.of(
                "id", "m2",
                "group_id", "g1",
                "sender_id", "u1",
                "text", "legacy",
                "created_at", "2025-03-01 10:00:00+00")));

        assertThat(m.content()).isEqualTo("legacy");
        assertThat(m.createdAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    void acceptsZonelessAndEpochTimestamps() throws Exception {
        Message local = decoder.decode(base("2025-03-01T10:00:00"));
        Message epoch = decoder.decode(base(1740823200000L));

        assertThat(local.createdAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
        assertThat(epoch.createdAt()).isEqualTo(Instant.ofEpochMilli(1740823200000L));
    }

    @Test
    void numericIdsAreReadAsText() throws Exception {
        Map<String, Object> columns = new HashMap<>(base("2025-03-01T10:00:00Z").columns());
        columns.put("id", 42);

        assertThat(decoder.decode(row(columns)).id()).isEqualTo("42");
    }

    @Test
    void ignoresUnknownColumns() throws Exception {
        Map<String, Object> columns = new HashMap<>(base("2025-03-01T10:00:00Z").columns());
        columns.put("reactions", Map.of("thumbs_up", 3));

        assertThat(decoder.decode(row(columns)).id()).isEqualTo("m1");
    }

    @Test
    void missingColumnIsDecodeError() {
        Map<String, Object> columns = new HashMap<>(base("2025-03-01T10:00:00Z").columns());
        columns.remove("sender_id");

        assertThatThrownBy(() -> decoder.decode(row(columns)))
                .isInstanceOf(MessageDecodeException.class)
                .hasMessageContaining("sender_id");
    }

    @Test
    void blankContentIsDecodeError() {
        Map<String, Object> columns = new HashMap<>(base("2025-03-01T10:00:00Z").columns());
        columns.put("content", "  ");

        assertThatThrownBy(() -> decoder.decode(row(columns))).isInstanceOf(MessageDecodeException.class);
    }

    @Test
    void garbageTimestampIsDecodeError() {
        assertThatThrownBy(() -> decoder.decode(base("yesterday")))
                .isInstanceOf(MessageDecodeException.class);
    }

    @Test
    void registeredAsService() {
        assertThat(MessageDecoders.load()).isInstanceOf(JacksonMessageDecoder.class);
    }

    private static RawMessage base(Object timestamp) {
        return row(Map.of(
                "id", "m1",
                "group_id", "g1",
                "sender_id", "u1",
                "content", "hi",
                "timestamp", timestamp));
    }

    private static RawMessage row(Map<String, Object> columns) {
        return new RawMessage(columns);
    }
}
