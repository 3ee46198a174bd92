package io.chatsync.http;

import io.chatsync.core.Message;
import io.chatsync.json.jackson.JacksonMessageDecoder;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteStoreException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestRemoteStoreTest {

    private MockWebServer server;
    private RestRemoteStore store;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        store = RestRemoteStore.builder(server.url("/rest/v1").uri())
                .credentials(ApiCredentials.apiKey("anon-key", () -> "user-token"))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void fetchRecentQueriesNewestFirst() throws Exception {
        server.enqueue(json(200, "[" +
                "{\"id\":\"m2\",\"group_id\":\"group-1\",\"sender_id\":\"bob\",\"content\":\"hi\",\"timestamp\":\"2025-03-01T10:00:02Z\"}," +
                "{\"id\":\"m1\",\"group_id\":\"group-1\",\"sender_id\":\"alice\",\"content\":\"hey\",\"timestamp\":\"2025-03-01T10:00:01Z\"}]"));

        List<RawMessage> rows = store.fetchRecent("group-1", 25);

        assertThat(rows).extracting(r -> r.text(RawMessage.COL_ID)).containsExactly("m2", "m1");
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo(
                "/rest/v1/messages?select=*&group_id=eq.group-1&order=timestamp.desc&limit=25");
        assertThat(recorded.getHeader("apikey")).isEqualTo("anon-key");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer user-token");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void fetchedRowsDecode() throws Exception {
        server.enqueue(json(200,
                "[{\"id\":\"m1\",\"group_id\":\"group-1\",\"sender_id\":\"alice\",\"content\":\"hey\",\"timestamp\":\"2025-03-01T10:00:01+00:00\"}]"));

        Message m = new JacksonMessageDecoder().decode(store.fetchRecent("group-1", 10).get(0));

        assertThat(m.id()).isEqualTo("m1");
        assertThat(m.senderId()).isEqualTo("alice");
        assertThat(m.createdAt()).isEqualTo(Instant.parse("2025-03-01T10:00:01Z"));
    }

    @Test
    void emptyConversationYieldsNoRows() throws Exception {
        server.enqueue(json(200, "[]"));

        assertThat(store.fetchRecent("group-1", 10)).isEmpty();
    }

    @Test
    void insertPostsRowAndReturnsRepresentation() throws Exception {
        server.enqueue(json(201,
                "[{\"id\":\"m9\",\"group_id\":\"group-1\",\"sender_id\":\"alice\",\"content\":\"hello\",\"timestamp\":\"2025-03-01T10:00:09Z\"}]"));

        RawMessage row = store.insert("group-1", "alice", "hello");

        assertThat(row.text(RawMessage.COL_ID)).isEqualTo("m9");
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/rest/v1/messages");
        assertThat(recorded.getHeader("Prefer")).isEqualTo("return=representation");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getBody().readUtf8())
                .isEqualTo("{\"group_id\":\"group-1\",\"sender_id\":\"alice\",\"content\":\"hello\"}");
    }

    @Test
    void insertAcceptsSingleObjectResponse() throws Exception {
        server.enqueue(json(201,
                "{\"id\":\"m9\",\"group_id\":\"group-1\",\"sender_id\":\"alice\",\"content\":\"hello\",\"timestamp\":\"2025-03-01T10:00:09Z\"}"));

        assertThat(store.insert("group-1", "alice", "hello").text(RawMessage.COL_CONTENT)).isEqualTo("hello");
    }

    @Test
    void apiKeyIsBearerWithoutUserToken() throws Exception {
        RestRemoteStore anonymous = RestRemoteStore.builder(server.url("/rest/v1/").uri())
                .credentials(ApiCredentials.apiKey("anon-key"))
                .build();
        server.enqueue(json(200, "[]"));

        anonymous.fetchRecent("group-1", 1);

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).startsWith("/rest/v1/messages?");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer anon-key");
    }

    @Test
    void errorStatusCarriesStatusAndBody() {
        server.enqueue(json(401, "{\"message\":\"JWT expired\"}"));

        assertThatThrownBy(() -> store.insert("group-1", "alice", "hello"))
                .isInstanceOf(RemoteStoreException.class)
                .hasMessageContaining("JWT expired")
                .satisfies(e -> assertThat(((RemoteStoreException) e).status()).isEqualTo(401));
    }

    @Test
    void malformedJsonIsReported() {
        server.enqueue(json(200, "not json"));

        assertThatThrownBy(() -> store.fetchRecent("group-1", 5))
                .isInstanceOf(RemoteStoreException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void nonArrayHistoryIsReported() {
        server.enqueue(json(200, "{\"id\":\"m1\"}"));

        assertThatThrownBy(() -> store.fetchRecent("group-1", 5))
                .isInstanceOf(RemoteStoreException.class)
                .hasMessageContaining("array");
    }

    @Test
    void unreachableServerHasNoStatus() throws Exception {
        server.shutdown();

        assertThatThrownBy(() -> store.fetchRecent("group-1", 5))
                .isInstanceOf(RemoteStoreException.class)
                .satisfies(e -> assertThat(((RemoteStoreException) e).status()).isEqualTo(RemoteStoreException.NO_STATUS));
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> store.fetchRecent("group-1", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
                .setResponseCode(status)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
