package com.p14n.eventbus.broker;

import java.util.Map;

/**
 * Thread-safe message broker interface for publishing messages and managing
 * subscribers. This is the whole contract the event bus relies on, so a
 * distributed broker only has to provide these operations.
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Starts delivery. Starting a running broker has no effect.
     *
     * @throws BrokerException if the broker could not be started
     */
    void start();

    /**
     * Stops delivery. Messages still queued are dropped. Stopping a stopped broker
     * has no effect.
     *
     * @throws BrokerException if the broker could not be stopped cleanly
     */
    void stop();

    /**
     * @return true while the broker is started
     */
    boolean isRunning();

    /**
     * Adds a subscriber to receive every message published to the channel, after
     * the subscribers already registered there.
     *
     * @param channel    The channel to subscribe to
     * @param subscriber The subscriber to add
     * @return the handle of this registration
     * @throws IllegalArgumentException if channel or subscriber is missing
     */
    Subscription subscribe(String channel, MessageSubscriber subscriber);

    /**
     * Removes one registration.
     *
     * @param subscription the handle returned by {@link #subscribe}
     * @return true if the registration was removed, false if it wasn't present
     */
    boolean unsubscribe(Subscription subscription);

    /**
     * Publishes a message to all subscribers of the specified channel. Never
     * blocks: a channel without subscribers or with a full queue is reported in
     * the result, not by an exception.
     *
     * @param channel The channel to publish to
     * @param payload The message to publish
     * @param headers Metadata for the message, may be null
     * @return the outcome, including the number of recipients
     * @throws IllegalStateException    if the broker is not running
     * @throws IllegalArgumentException if the channel is missing
     */
    PublishResult publish(String channel, Map<String, Object> payload, Map<String, String> headers);

    default PublishResult publish(String channel, Map<String, Object> payload) {
        return publish(channel, payload, null);
    }

    /**
     * Stops the broker and releases any resources it owns.
     */
    @Override
    default void close() {
        stop();
    }
}
