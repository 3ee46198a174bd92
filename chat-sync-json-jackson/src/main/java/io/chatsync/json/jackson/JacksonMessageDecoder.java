package io.chatsync.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.chatsync.core.Message;
import io.chatsync.remote.MessageDecodeException;
import io.chatsync.remote.MessageDecoder;
import io.chatsync.remote.RawMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * Jackson implementation of {@link MessageDecoder}.
 *
 * <p>Registered through {@code META-INF/services}, so {@link io.chatsync.remote.MessageDecoders#load()}
 * picks it up when this module is on the class path.
 */
public final class JacksonMessageDecoder implements MessageDecoder {

    private final ObjectMapper mapper;

    /**
     * Creates a decoder with a default ObjectMapper.
     */
    public JacksonMessageDecoder() {
        this(new ObjectMapper());
    }

    /**
     * Creates a decoder from a copy of {@code mapper} with the timestamp reader installed.
     *
     * @param mapper base mapper; it is not modified
     */
    public JacksonMessageDecoder(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        SimpleModule timestamps = new SimpleModule("chat-sync-timestamps");
        timestamps.addDeserializer(Instant.class, new FlexibleInstantDeserializer());
        this.mapper = mapper.copy()
                .registerModule(timestamps)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Message decode(RawMessage raw) throws MessageDecodeException {
        Objects.requireNonNull(raw, "raw");
        MessageRow row;
        try {
            row = mapper.convertValue(raw.columns(), MessageRow.class);
        } catch (IllegalArgumentException e) {
            throw new MessageDecodeException("Malformed message row: " + e.getMessage(), e);
        }

        require(row.id, "id");
        require(row.conversationId, "group_id");
        require(row.senderId, "sender_id");
        require(row.content, "content");
        if (row.timestamp == null) throw new MessageDecodeException("Missing column: timestamp");

        try {
            return new Message(row.id, row.conversationId, row.senderId, row.content, row.timestamp);
        } catch (IllegalArgumentException e) {
            throw new MessageDecodeException("Invalid message row: " + e.getMessage(), e);
        }
    }

    private static void require(String value, String column) throws MessageDecodeException {
        if (value == null || value.isBlank()) {
            throw new MessageDecodeException("Missing column: " + column);
        }
    }
}
