package io.chatsync.remote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One undecoded row of the {@code messages} table, as delivered by the backend.
 *
 * <p>Column names follow the backend schema. Values are whatever the transport produced (strings,
 * numbers, nested maps); interpreting them is the job of a {@link MessageDecoder}.
 *
 * @param columns column name to value; {@code null} values are kept
 */
public record RawMessage(Map<String, Object> columns) {

    public static final String COL_ID = "id";
    public static final String COL_CONVERSATION = "group_id";
    public static final String COL_SENDER = "sender_id";
    public static final String COL_CONTENT = "content";
    public static final String COL_TIMESTAMP = "timestamp";

    public RawMessage {
        Objects.requireNonNull(columns, "columns");
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Object get(String column) {
        return columns.get(column);
    }

    /**
     * String form of a column, or {@code null} when absent.
     */
    public String text(String column) {
        Object v = columns.get(column);
        return v == null ? null : v.toString();
    }

    /**
     * The conversation column, used to filter misrouted rows before decoding.
     */
    public String conversationId() {
        return text(COL_CONVERSATION);
    }
}
