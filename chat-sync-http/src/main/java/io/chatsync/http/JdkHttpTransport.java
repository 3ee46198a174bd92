package io.chatsync.http;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RestTransport} on {@link java.net.http.HttpClient}.
 */
public final class JdkHttpTransport implements RestTransport {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        HttpResponse<byte[]> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(),
                resp.body() == null ? new byte[0] : resp.body());
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        HttpResponse<InputStream> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body());
    }

    static HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url());
        if (request.body() == null) {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
        }
        if (request.timeout() != null) builder.timeout(request.timeout());
        request.headers().forEach((name, values) -> addHeader(builder, name, values));
        return builder.build();
    }

    private static void addHeader(HttpRequest.Builder builder, String name, List<String> values) {
        for (String value : values) {
            if (value != null) builder.header(name, value);
        }
    }
}
