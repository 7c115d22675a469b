package com.p14n.eventbus.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for message broker operations.
 * Tracks published, delivered and failed messages, and the number of active
 * subscribers, across different channels.
 *
 * <p>
 * This class provides four metrics:
 * </p>
 * <ul>
 * <li>messages_published: Counter for messages accepted onto a channel queue</li>
 * <li>messages_received: Counter for successful subscriber invocations</li>
 * <li>messages_failed: Counter for rejected messages and subscriber faults</li>
 * <li>active_subscribers: Up/down counter for current number of subscribers per
 * channel</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongCounter failedMessages;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages accepted onto a channel queue")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages handled by subscribers")
                                .build();

                failedMessages = meter.counterBuilder("messages_failed")
                                .setDescription("Number of rejected messages and subscriber failures")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        /**
         * Records a message accepted onto the queue of the specified channel.
         *
         * @param channel The channel the message was published to
         */
        public void recordPublished(String channel) {
                publishedMessages.add(1, Attributes.of(CHANNEL, channel));
        }

        /**
         * Records a successful subscriber invocation for the specified channel.
         *
         * @param channel The channel the message was received from
         */
        public void recordReceived(String channel) {
                receivedMessages.add(1, Attributes.of(CHANNEL, channel));
        }

        /**
         * Records a full-queue rejection or a subscriber failure for the specified
         * channel.
         *
         * @param channel The channel the failure happened on
         */
        public void recordFailed(String channel) {
                failedMessages.add(1, Attributes.of(CHANNEL, channel));
        }

        /**
         * Records the addition of a subscriber for the specified channel.
         *
         * @param channel The channel the subscriber was added to
         */
        public void recordSubscriberAdded(String channel) {
                activeSubscribers.add(1, Attributes.of(CHANNEL, channel));
        }

        /**
         * Records the removal of a subscriber for the specified channel.
         *
         * @param channel The channel the subscriber was removed from
         */
        public void recordSubscriberRemoved(String channel) {
                activeSubscribers.add(-1, Attributes.of(CHANNEL, channel));
        }
}
