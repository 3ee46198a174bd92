package io.chatsync.http;

import java.util.List;
import java.util.Map;

public record TransportResponse<T>(int status, Map<String, List<String>> headers, T body) {
    public TransportResponse {
        headers = headers == null ? Map.of() : headers;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
