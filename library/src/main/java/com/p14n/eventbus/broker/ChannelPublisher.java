package com.p14n.eventbus.broker;

import java.util.Map;
import java.util.function.Function;

/**
 * Publishes the results of a function to a fixed channel.
 *
 * <pre>{@code
 * Function<Order, Map<String, Object>> confirm = broker.publisher("orders.confirmed")
 *         .wrap(order -> Map.of("order_id", order.id(), "status", "ok"));
 * confirm.apply(order); // also published to orders.confirmed
 * }</pre>
 */
public class ChannelPublisher {

    private final MessageBroker broker;
    private final String channel;

    public ChannelPublisher(MessageBroker broker, String channel) {
        if (broker == null) {
            throw new IllegalArgumentException("Broker cannot be null");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel is required");
        }
        this.broker = broker;
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }

    public PublishResult publish(Map<String, Object> payload) {
        return broker.publish(channel, payload);
    }

    /**
     * Returns a function that calls {@code function} and publishes its result
     * when the result is not null. The result is returned unchanged.
     */
    public <T> Function<T, Map<String, Object>> wrap(Function<T, Map<String, Object>> function) {
        return input -> {
            Map<String, Object> result = function.apply(input);
            if (result != null) {
                broker.publish(channel, result);
            }
            return result;
        };
    }
}
