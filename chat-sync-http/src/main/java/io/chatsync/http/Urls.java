package io.chatsync.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

final class Urls {
    private Urls() {}

    /**
     * Appends one path segment to {@code base}, keeping any path it already has.
     */
    static URI resolve(URI base, String segment) {
        String b = base.toString();
        return URI.create(b.endsWith("/") ? b + segment : b + "/" + segment);
    }

    /**
     * Appends URL-encoded query parameters in iteration order. Null values are skipped.
     */
    static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        StringJoiner query = new StringJoiner("&");
        params.forEach((k, v) -> {
            if (k != null && v != null) query.add(encode(k) + "=" + encode(v));
        });
        if (query.length() == 0) return base;
        return URI.create(base + (base.getQuery() == null ? "?" : "&") + query);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
