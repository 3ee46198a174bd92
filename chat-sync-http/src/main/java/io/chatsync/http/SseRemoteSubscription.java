package io.chatsync.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatsync.remote.ChannelStatus;
import io.chatsync.remote.RawMessage;
import io.chatsync.remote.RemoteStoreException;
import io.chatsync.remote.RemoteSubscription;
import io.chatsync.remote.SubscriptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live inserts over a server-sent-events endpoint.
 *
 * <pre>
 * GET {url}?conversation={id}    Accept: text/event-stream
 *
 * event: status
 * data: SUBSCRIBED
 *
 * event: insert
 * data: {"id":"...","group_id":"...","sender_id":"...","content":"...","timestamp":"..."}
 * </pre>
 *
 * <p>Every subscriber gets its own stream, read on a daemon thread. Cancelling the subscription
 * closes the stream; the end of the stream completes the publisher.
 */
public final class SseRemoteSubscription implements RemoteSubscription {

    private static final Logger log = LoggerFactory.getLogger(SseRemoteSubscription.class);
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {};
    private static final AtomicInteger THREADS = new AtomicInteger();

    static final String EVENT_STATUS = "status";
    static final String EVENT_INSERT = "insert";

    private final URI url;
    private final ApiCredentials credentials;
    private final RestTransport transport;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public SseRemoteSubscription(URI url, ApiCredentials credentials) {
        this(url, credentials, new JdkHttpTransport(), new ObjectMapper(), null);
    }

    /**
     * @param timeout time allowed until the response headers arrive; {@code null} for none
     */
    public SseRemoteSubscription(URI url, ApiCredentials credentials, RestTransport transport, ObjectMapper mapper,
                                 Duration timeout) {
        this.url = Objects.requireNonNull(url, "url");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = timeout;
    }

    @Override
    public Flow.Publisher<SubscriptionEvent> open(String conversationId) {
        Objects.requireNonNull(conversationId, "conversationId");
        return subscriber -> {
            Objects.requireNonNull(subscriber, "subscriber");
            Stream stream = new Stream(conversationId);
            stream.pub.subscribe(new CancellingSubscriber(stream, subscriber));
            Thread t = new Thread(stream::run, "chat-sync-sse-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            t.start();
        };
    }

    private final class Stream {
        private final String conversationId;
        private final SubmissionPublisher<SubscriptionEvent> pub = new SubmissionPublisher<>();
        private final AtomicReference<InputStream> body = new AtomicReference<>();
        private volatile boolean cancelled;

        private Stream(String conversationId) {
            this.conversationId = conversationId;
        }

        void run() {
            Map<String, List<String>> headers = credentials.headers();
            headers.put("Accept", List.of("text/event-stream"));
            URI target = Urls.withQuery(url, Map.of("conversation", conversationId));

            try {
                TransportResponse<InputStream> resp = transport.sendStream(
                        TransportRequest.get(target, headers, timeout));
                if (resp.status() != 200) {
                    closeQuietly(resp.body());
                    pub.closeExceptionally(new RemoteStoreException(
                            "Live channel rejected with status " + resp.status(), resp.status(), null));
                    return;
                }
                body.set(resp.body());
                if (cancelled) {
                    closeQuietly(resp.body());
                    return;
                }

                try (SseParser parser = new SseParser(resp.body())) {
                    SseParser.Event ev;
                    while (!cancelled && (ev = parser.next()) != null) {
                        SubscriptionEvent event = toEvent(ev);
                        if (event != null) pub.submit(event);
                    }
                }
                log.debug("Live channel of conversation {} ended", conversationId);
                pub.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pub.closeExceptionally(new RemoteStoreException("Interrupted", e));
            } catch (Exception e) {
                if (cancelled) {
                    log.debug("Live channel of conversation {} closed", conversationId);
                    pub.close();
                } else {
                    pub.closeExceptionally(e instanceof RemoteStoreException ? e
                            : new RemoteStoreException("Live channel failed: " + e.getMessage(), e));
                }
            }
        }

        void cancel() {
            cancelled = true;
            closeQuietly(body.get());
        }

        private SubscriptionEvent toEvent(SseParser.Event ev) {
            switch (ev.eventType()) {
                case EVENT_STATUS:
                    try {
                        return new SubscriptionEvent.StatusChanged(ChannelStatus.valueOf(ev.data().trim()));
                    } catch (IllegalArgumentException e) {
                        log.warn("Unknown channel status '{}' on conversation {}", ev.data(), conversationId);
                        return null;
                    }
                case EVENT_INSERT:
                    try {
                        return new SubscriptionEvent.RowInserted(new RawMessage(mapper.readValue(ev.data(), ROW)));
                    } catch (IOException e) {
                        log.warn("Skipping malformed row on conversation {}: {}", conversationId, e.getMessage());
                        return null;
                    }
                default:
                    log.debug("Ignoring '{}' event on conversation {}", ev.eventType(), conversationId);
                    return null;
            }
        }
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close event stream", e);
        }
    }

    /**
     * Closes the HTTP stream when the downstream subscriber cancels.
     */
    private static final class CancellingSubscriber implements Flow.Subscriber<SubscriptionEvent> {
        private final Stream stream;
        private final Flow.Subscriber<? super SubscriptionEvent> downstream;

        private CancellingSubscriber(Stream stream, Flow.Subscriber<? super SubscriptionEvent> downstream) {
            this.stream = stream;
            this.downstream = downstream;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            downstream.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    stream.cancel();
                    subscription.cancel();
                }
            });
        }

        @Override
        public void onNext(SubscriptionEvent item) {
            downstream.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            downstream.onComplete();
        }
    }
}
