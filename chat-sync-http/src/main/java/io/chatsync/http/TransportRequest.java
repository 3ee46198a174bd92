package io.chatsync.http;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One outgoing HTTP call of the remote adapters.
 *
 * @param timeout {@code null} leaves the transport default
 */
public record TransportRequest(
        String method,
        URI url,
        Map<String, List<String>> headers,
        byte[] body,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    static TransportRequest get(URI url, Map<String, List<String>> headers, Duration timeout) {
        return new TransportRequest("GET", url, headers, null, timeout);
    }

    static TransportRequest post(URI url, Map<String, List<String>> headers, byte[] body, Duration timeout) {
        return new TransportRequest("POST", url, headers, Objects.requireNonNull(body, "body"), timeout);
    }
}
