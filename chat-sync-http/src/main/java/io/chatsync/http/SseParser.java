package io.chatsync.http;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads server-sent events one at a time.
 *
 * <p>Only {@code event} and {@code data} fields are kept; {@code id}, {@code retry} and comment
 * lines are skipped. Consecutive {@code data} lines are joined with {@code \n}. An event without
 * an {@code event} field has type {@code message}.
 */
final class SseParser implements AutoCloseable {

    static final String DEFAULT_TYPE = "message";

    record Event(String eventType, String data) {}

    private final BufferedReader in;

    SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * @return the next complete event, or {@code null} once the stream has ended
     */
    Event next() throws IOException {
        String type = null;
        StringBuilder data = null;

        for (String line = in.readLine(); line != null; line = in.readLine()) {
            if (line.isEmpty()) {
                if (type != null || data != null) return event(type, data);
                continue;
            }
            int colon = line.indexOf(':');
            if (colon == 0) continue;

            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : fieldValue(line, colon);
            if ("event".equals(field)) {
                type = value;
            } else if ("data".equals(field)) {
                data = data == null ? new StringBuilder(value) : data.append('\n').append(value);
            }
        }
        return type != null || data != null ? event(type, data) : null;
    }

    private static String fieldValue(String line, int colon) {
        int start = colon + 1;
        if (start < line.length() && line.charAt(start) == ' ') start++;
        return line.substring(start);
    }

    private static Event event(String type, StringBuilder data) {
        return new Event(type == null || type.isEmpty() ? DEFAULT_TYPE : type, data == null ? "" : data.toString());
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
