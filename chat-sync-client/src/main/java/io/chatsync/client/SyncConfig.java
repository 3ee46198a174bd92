package io.chatsync.client;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Tuning knobs of a {@link SyncEngine}.
 *
 * <p>Configure in code through {@link #builder()} or with properties:
 * <pre>
 * chat-sync.history.limit=50
 * chat-sync.reconnect.initial-delay-ms=1000
 * chat-sync.reconnect.multiplier=2.0
 * chat-sync.reconnect.max-delay-ms=30000
 * chat-sync.reconnect.jitter=0.0
 * chat-sync.reconnect.max-attempts=10
 * chat-sync.reconnect.catch-up=true
 * </pre>
 */
public final class SyncConfig {

    public static final String DEFAULT_RESOURCE = "chat-sync.properties";

    static final String HISTORY_LIMIT = "chat-sync.history.limit";
    static final String INITIAL_DELAY = "chat-sync.reconnect.initial-delay-ms";
    static final String MULTIPLIER = "chat-sync.reconnect.multiplier";
    static final String MAX_DELAY = "chat-sync.reconnect.max-delay-ms";
    static final String JITTER = "chat-sync.reconnect.jitter";
    static final String MAX_ATTEMPTS = "chat-sync.reconnect.max-attempts";
    static final String CATCH_UP = "chat-sync.reconnect.catch-up";

    private final int historyLimit;
    private final Duration reconnectInitialDelay;
    private final double reconnectMultiplier;
    private final Duration reconnectMaxDelay;
    private final double reconnectJitter;
    private final int maxReconnectAttempts;
    private final boolean catchUpOnResubscribe;

    private SyncConfig(Builder b) {
        if (b.historyLimit <= 0) throw new IllegalArgumentException("historyLimit must be positive");
        if (b.maxReconnectAttempts < 0) throw new IllegalArgumentException("maxReconnectAttempts must not be negative");
        this.historyLimit = b.historyLimit;
        this.reconnectInitialDelay = b.reconnectInitialDelay;
        this.reconnectMultiplier = b.reconnectMultiplier;
        this.reconnectMaxDelay = b.reconnectMaxDelay;
        this.reconnectJitter = b.reconnectJitter;
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.catchUpOnResubscribe = b.catchUpOnResubscribe;
        backoff();
    }

    public static SyncConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the class path, falling back to defaults when absent.
     */
    public static SyncConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static SyncConfig load(String resource) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = SyncConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) return defaults();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }

    /**
     * Builds a config from {@code chat-sync.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static SyncConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String v;
        if ((v = value(props, HISTORY_LIMIT)) != null) b.historyLimit(parseInt(HISTORY_LIMIT, v));
        if ((v = value(props, INITIAL_DELAY)) != null) b.reconnectInitialDelay(Duration.ofMillis(parseLong(INITIAL_DELAY, v)));
        if ((v = value(props, MULTIPLIER)) != null) b.reconnectMultiplier(parseDouble(MULTIPLIER, v));
        if ((v = value(props, MAX_DELAY)) != null) b.reconnectMaxDelay(Duration.ofMillis(parseLong(MAX_DELAY, v)));
        if ((v = value(props, JITTER)) != null) b.reconnectJitter(parseDouble(JITTER, v));
        if ((v = value(props, MAX_ATTEMPTS)) != null) b.maxReconnectAttempts(parseInt(MAX_ATTEMPTS, v));
        if ((v = value(props, CATCH_UP)) != null) b.catchUpOnResubscribe(Boolean.parseBoolean(v));
        return b.build();
    }

    /**
     * Number of most recent messages fetched when a conversation opens.
     */
    public int historyLimit() {
        return historyLimit;
    }

    public Duration reconnectInitialDelay() {
        return reconnectInitialDelay;
    }

    public double reconnectMultiplier() {
        return reconnectMultiplier;
    }

    public Duration reconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public double reconnectJitter() {
        return reconnectJitter;
    }

    /**
     * Consecutive failed reconnects after which the connection is reported offline; 0 retries forever.
     */
    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    /**
     * Whether history is re-fetched after the live feed recovers, to pick up messages missed while offline.
     */
    public boolean catchUpOnResubscribe() {
        return catchUpOnResubscribe;
    }

    public ReconnectBackoff backoff() {
        return new ReconnectBackoff(reconnectInitialDelay, reconnectMultiplier, reconnectMaxDelay, reconnectJitter);
    }

    @Override
    public String toString() {
        return "SyncConfig{historyLimit=" + historyLimit
                + ", reconnectInitialDelay=" + reconnectInitialDelay
                + ", reconnectMultiplier=" + reconnectMultiplier
                + ", reconnectMaxDelay=" + reconnectMaxDelay
                + ", reconnectJitter=" + reconnectJitter
                + ", maxReconnectAttempts=" + maxReconnectAttempts
                + ", catchUpOnResubscribe=" + catchUpOnResubscribe + '}';
    }

    private static String value(Properties props, String key) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + v, e);
        }
    }

    private static long parseLong(String key, String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + v, e);
        }
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }

    public static final class Builder {
        private int historyLimit = 50;
        private Duration reconnectInitialDelay = Duration.ofSeconds(1);
        private double reconnectMultiplier = 2.0;
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private double reconnectJitter = 0.0;
        private int maxReconnectAttempts = 10;
        private boolean catchUpOnResubscribe = true;

        private Builder() {}

        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public Builder reconnectInitialDelay(Duration delay) {
            this.reconnectInitialDelay = Objects.requireNonNull(delay, "delay");
            return this;
        }

        public Builder reconnectMultiplier(double multiplier) {
            this.reconnectMultiplier = multiplier;
            return this;
        }

        public Builder reconnectMaxDelay(Duration delay) {
            this.reconnectMaxDelay = Objects.requireNonNull(delay, "delay");
            return this;
        }

        public Builder reconnectJitter(double jitter) {
            this.reconnectJitter = jitter;
            return this;
        }

        public Builder maxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder catchUpOnResubscribe(boolean enabled) {
            this.catchUpOnResubscribe = enabled;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(this);
        }
    }
}
