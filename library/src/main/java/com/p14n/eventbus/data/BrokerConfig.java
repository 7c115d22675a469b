package com.p14n.eventbus.data;

import java.time.Duration;

/**
 * Configuration interface for message broker settings.
 * Defines the queueing and timing parameters shared by every channel of a
 * broker.
 */
public interface BrokerConfig {

    /**
     * Gets the capacity of each channel queue. Fixed for the lifetime of the
     * broker.
     *
     * @return The maximum number of pending envelopes per channel
     */
    default int maxQueueSize() {
        return 1000;
    }

    /**
     * Gets the bounded wait used by consumer loops when polling a channel queue.
     * A stop signal is observed within one interval.
     *
     * @return The poll interval
     */
    default Duration pollInterval() {
        return Duration.ofMillis(500);
    }

    /**
     * Gets how long {@code stop()} waits for consumer loops to finish.
     *
     * @return The shutdown timeout
     */
    default Duration shutdownTimeout() {
        return Duration.ofSeconds(5);
    }

    /**
     * Gets the timeout applied to requests that do not supply their own.
     *
     * @return The default request timeout
     */
    default Duration requestTimeout() {
        return Duration.ofMillis(500);
    }
}
