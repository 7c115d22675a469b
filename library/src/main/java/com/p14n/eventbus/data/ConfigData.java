package com.p14n.eventbus.data;

import java.time.Duration;
import java.util.Properties;

public record ConfigData(int maxQueueSize,
        Duration pollInterval,
        Duration shutdownTimeout,
        Duration requestTimeout) implements BrokerConfig {

    public static final String PREFIX = "eventbus.";

    private static final BrokerConfig DEFAULTS = new BrokerConfig() {
    };

    public ConfigData {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive");
        }
        requirePositive(pollInterval, "pollInterval");
        requirePositive(shutdownTimeout, "shutdownTimeout");
        requirePositive(requestTimeout, "requestTimeout");
    }

    public ConfigData(int maxQueueSize) {
        this(maxQueueSize, DEFAULTS.pollInterval(), DEFAULTS.shutdownTimeout(), DEFAULTS.requestTimeout());
    }

    public ConfigData(int maxQueueSize, Duration pollInterval) {
        this(maxQueueSize, pollInterval, DEFAULTS.shutdownTimeout(), DEFAULTS.requestTimeout());
    }

    public static ConfigData defaults() {
        return new ConfigData(DEFAULTS.maxQueueSize());
    }

    /**
     * Reads {@code eventbus.maxQueueSize}, {@code eventbus.pollIntervalMs},
     * {@code eventbus.shutdownTimeoutMs} and {@code eventbus.requestTimeoutMs},
     * using the defaults for missing keys.
     *
     * @throws IllegalArgumentException if a value is not a positive number
     */
    public static ConfigData fromProperties(Properties props) {
        return new ConfigData(
                readInt(props, "maxQueueSize", DEFAULTS.maxQueueSize()),
                Duration.ofMillis(readLong(props, "pollIntervalMs", DEFAULTS.pollInterval().toMillis())),
                Duration.ofMillis(readLong(props, "shutdownTimeoutMs", DEFAULTS.shutdownTimeout().toMillis())),
                Duration.ofMillis(readLong(props, "requestTimeoutMs", DEFAULTS.requestTimeout().toMillis())));
    }

    private static int readInt(Properties props, String key, int fallback) {
        long value = readLong(props, key, fallback);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long readLong(Properties props, String key, long fallback) {
        String value = props == null ? null : props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
