package io.chatsync.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteAppend;
import io.chatsync.remote.RemoteHistoryQuery;
import io.chatsync.remote.RemoteStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * History and append over a PostgREST-style table endpoint.
 *
 * <pre>
 * GET  {base}/messages?select=*&amp;group_id=eq.{id}&amp;order=timestamp.desc&amp;limit={n}
 * POST {base}/messages            Prefer: return=representation
 * </pre>
 */
public final class RestRemoteStore implements RemoteHistoryQuery, RemoteAppend {

    private static final Logger log = LoggerFactory.getLogger(RestRemoteStore.class);
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {};
    private static final int MAX_ERROR_BODY = 200;

    private final URI baseUrl;
    private final String table;
    private final ApiCredentials credentials;
    private final RestTransport transport;
    private final ObjectMapper mapper;
    private final Duration timeout;

    private RestRemoteStore(Builder b) {
        this.baseUrl = b.baseUrl;
        this.table = b.table;
        this.credentials = b.credentials;
        this.transport = b.transport == null ? new JdkHttpTransport() : b.transport;
        this.mapper = b.mapper == null ? new ObjectMapper() : b.mapper;
        this.timeout = b.timeout;
    }

    public static Builder builder(URI baseUrl) {
        return new Builder(baseUrl);
    }

    @Override
    public List<RawMessage> fetchRecent(String conversationId, int limit) throws RemoteStoreException {
        Objects.requireNonNull(conversationId, "conversationId");
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");

        Map<String, String> query = new LinkedHashMap<>();
        query.put("select", "*");
        query.put(RawMessage.COL_CONVERSATION, "eq." + conversationId);
        query.put("order", RawMessage.COL_TIMESTAMP + ".desc");
        query.put("limit", Integer.toString(limit));
        URI url = Urls.withQuery(Urls.resolve(baseUrl, table), query);

        TransportResponse<byte[]> resp = send(TransportRequest.get(url, headers(false), timeout));
        JsonNode body = parse(resp);
        if (!body.isArray()) {
            throw new RemoteStoreException("Expected a JSON array of rows", resp.status(), null);
        }
        List<RawMessage> rows = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            rows.add(toRow(node, resp.status()));
        }
        log.debug("Fetched {} rows of conversation {}", rows.size(), conversationId);
        return rows;
    }

    @Override
    public RawMessage insert(String conversationId, String senderId, String content) throws RemoteStoreException {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(content, "content");

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(RawMessage.COL_CONVERSATION, conversationId);
        row.put(RawMessage.COL_SENDER, senderId);
        row.put(RawMessage.COL_CONTENT, content);
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(row);
        } catch (JsonProcessingException e) {
            throw new RemoteStoreException("Failed to encode row", e);
        }

        TransportResponse<byte[]> resp = send(TransportRequest.post(Urls.resolve(baseUrl, table),
                headers(true), payload, timeout));
        JsonNode body = parse(resp);
        JsonNode inserted = body.isArray() ? body.path(0) : body;
        if (!inserted.isObject()) {
            throw new RemoteStoreException("Insert returned no row", resp.status(), null);
        }
        return toRow(inserted, resp.status());
    }

    private Map<String, List<String>> headers(boolean write) {
        Map<String, List<String>> headers = credentials.headers();
        headers.put("Accept", List.of("application/json"));
        if (write) {
            headers.put("Content-Type", List.of("application/json"));
            headers.put("Prefer", List.of("return=representation"));
        }
        return headers;
    }

    private TransportResponse<byte[]> send(TransportRequest request) throws RemoteStoreException {
        TransportResponse<byte[]> resp;
        try {
            resp = transport.sendBytes(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteStoreException("Interrupted", e);
        } catch (Exception e) {
            throw new RemoteStoreException(request.method() + " " + request.url().getPath() + " failed: " + e.getMessage(), e);
        }
        if (!resp.isSuccess()) {
            throw new RemoteStoreException(errorMessage(resp), resp.status(), null);
        }
        return resp;
    }

    private JsonNode parse(TransportResponse<byte[]> resp) throws RemoteStoreException {
        try {
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new RemoteStoreException("Malformed JSON response", resp.status(), e);
        }
    }

    private RawMessage toRow(JsonNode node, int status) throws RemoteStoreException {
        if (!node.isObject()) {
            throw new RemoteStoreException("Expected a JSON object row", status, null);
        }
        return new RawMessage(mapper.convertValue(node, ROW));
    }

    private static String errorMessage(TransportResponse<byte[]> resp) {
        String body = resp.body() == null ? "" : new String(resp.body(), StandardCharsets.UTF_8).trim();
        if (body.length() > MAX_ERROR_BODY) body = body.substring(0, MAX_ERROR_BODY) + "...";
        return body.isEmpty() ? "HTTP " + resp.status() : body;
    }

    public static final class Builder {
        private final URI baseUrl;
        private String table = "messages";
        private ApiCredentials credentials = ApiCredentials.none();
        private RestTransport transport;
        private ObjectMapper mapper;
        private Duration timeout = Duration.ofSeconds(30);

        private Builder(URI baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        }

        public Builder table(String table) {
            this.table = Objects.requireNonNull(table, "table");
            return this;
        }

        public Builder credentials(ApiCredentials credentials) {
            this.credentials = Objects.requireNonNull(credentials, "credentials");
            return this;
        }

        public Builder transport(RestTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public RestRemoteStore build() {
            return new RestRemoteStore(this);
        }
    }
}
