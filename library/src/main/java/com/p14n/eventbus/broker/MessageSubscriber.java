package com.p14n.eventbus.broker;

import java.util.Map;

/**
 * Handler registered on a broker channel.
 *
 * <p>
 * The broker delivers every message of the channel as a flat record. A
 * non-null, non-empty result is published back to the requester when the
 * message was sent with {@link MessageBroker#publish(String, Map, Map) a
 * reply channel}; otherwise it is ignored.
 * </p>
 */
@FunctionalInterface
public interface MessageSubscriber {

    /**
     * Called when a new message is available for processing.
     *
     * @param message The message to process
     * @return an optional reply, may be null
     * @throws Exception if the message could not be handled
     */
    Map<String, Object> onMessage(Map<String, Object> message) throws Exception;

    /**
     * Called when {@link #onMessage(Map)} failed.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }

    /**
     * Name used to identify this subscriber in logs and diagnostics.
     *
     * @return the subscriber name
     */
    default String name() {
        return getClass().getName();
    }

    /**
     * Subscriber that never replies.
     */
    @FunctionalInterface
    interface Listener {
        void onMessage(Map<String, Object> message) throws Exception;
    }

    static MessageSubscriber named(String name, MessageSubscriber delegate) {
        if (name == null || delegate == null) {
            throw new IllegalArgumentException("Name and subscriber cannot be null");
        }
        return new MessageSubscriber() {
            @Override
            public Map<String, Object> onMessage(Map<String, Object> message) throws Exception {
                return delegate.onMessage(message);
            }

            @Override
            public void onError(Throwable error) {
                delegate.onError(error);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    static MessageSubscriber listening(String name, Listener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        return named(name, message -> {
            listener.onMessage(message);
            return null;
        });
    }
}
