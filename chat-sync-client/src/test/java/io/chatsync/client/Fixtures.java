package io.chatsync.client;

import io.chatsync.core.Message;
import io.chatsync.core.PendingSend;
import io.chatsync.remote.RawMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

final class Fixtures {

    static final String CONV = "group-1";
    static final String ALICE = "alice";
    static final String BOB = "bob";
    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private Fixtures() {}

    static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    static Instant atMillis(long millis) {
        return T0.plusMillis(millis);
    }

    static Message message(String id, String sender, String content, Instant createdAt) {
        return new Message(id, CONV, sender, content, createdAt);
    }

    static PendingSend pending(String token, String sender, String content, Instant submittedAt) {
        return new PendingSend(token, CONV, sender, content, submittedAt, PendingSend.Status.IN_FLIGHT, null);
    }

    static RawMessage row(String id, String conversation, String sender, String content, Instant createdAt) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(RawMessage.COL_ID, id);
        columns.put(RawMessage.COL_CONVERSATION, conversation);
        columns.put(RawMessage.COL_SENDER, sender);
        columns.put(RawMessage.COL_CONTENT, content);
        columns.put(RawMessage.COL_TIMESTAMP, createdAt.toString());
        return new RawMessage(columns);
    }

    static RawMessage row(String id, String sender, String content, Instant createdAt) {
        return row(id, CONV, sender, content, createdAt);
    }

    static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(5);
        }
        return condition.getAsBoolean();
    }

    static final class MutableClock extends Clock {
        private volatile Instant instant;
        private final ZoneId zone;

        MutableClock(Instant instant) {
            this(instant, ZoneId.of("UTC"));
        }

        private MutableClock(Instant instant, ZoneId zone) {
            this.instant = instant;
            this.zone = zone;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(instant, zone);
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
