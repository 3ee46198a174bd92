package io.chatsync.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Project API key and optional user access token, sent as {@code apikey} and
 * {@code Authorization: Bearer} headers. Without an access token the key is used as the bearer.
 */
public final class ApiCredentials {

    private static final ApiCredentials NONE = new ApiCredentials(null, () -> null);

    private final String apiKey;
    private final Supplier<String> accessToken;

    private ApiCredentials(String apiKey, Supplier<String> accessToken) {
        this.apiKey = apiKey;
        this.accessToken = accessToken;
    }

    public static ApiCredentials none() {
        return NONE;
    }

    public static ApiCredentials apiKey(String apiKey) {
        Objects.requireNonNull(apiKey, "apiKey");
        return new ApiCredentials(apiKey, () -> null);
    }

    /**
     * @param accessToken supplies the signed-in user's token; may return {@code null}
     */
    public static ApiCredentials apiKey(String apiKey, Supplier<String> accessToken) {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(accessToken, "accessToken");
        return new ApiCredentials(apiKey, accessToken);
    }

    Map<String, List<String>> headers() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        if (apiKey == null) return headers;
        String token = accessToken.get();
        headers.put("apikey", List.of(apiKey));
        headers.put("Authorization", List.of("Bearer " + (token == null || token.isBlank() ? apiKey : token)));
        return headers;
    }
}
