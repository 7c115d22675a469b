package com.p14n.eventbus.broker;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.eventbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Drains one channel. Each envelope is handed to the channel's subscribers in
 * registration order, one after the other, so a slow subscriber holds up the
 * whole channel. The loop ends when its broker stops or the channel is retired;
 * a subscriber already running is allowed to finish.
 */
class ConsumerLoop implements Callable<Void> {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerLoop.class);

    private final DefaultMessageBroker broker;
    private final Channel channel;
    private final long generation;

    ConsumerLoop(DefaultMessageBroker broker, Channel channel, long generation) {
        this.broker = broker;
        this.channel = channel;
        this.generation = generation;
    }

    @Override
    public Void call() {
        channel.consumerThread(Thread.currentThread());
        logger.atDebug()
                .addArgument(channel.name())
                .log("Consumer loop started for channel {}");
        try {
            while (isActive()) {
                Envelope envelope;
                try {
                    envelope = channel.poll(broker.config().pollInterval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (envelope != null && isActive()) {
                    dispatch(envelope);
                }
            }
        } finally {
            channel.clearConsumerThread(Thread.currentThread());
            logger.atDebug()
                    .addArgument(channel.name())
                    .log("Consumer loop stopped for channel {}");
        }
        return null;
    }

    private boolean isActive() {
        return broker.isActive(generation) && !channel.isRetired();
    }

    void dispatch(Envelope envelope) {
        for (Subscription subscription : channel.subscriptions()) {
            MessageSubscriber subscriber = subscription.subscriber();
            Map<String, Object> result;
            try {
                result = processWithTelemetry(broker.openTelemetry(), broker.tracer(), "process_message",
                        channel.name(), subscriber.name(), envelope.headers(),
                        () -> subscriber.onMessage(envelope.payload()));
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) {
                broker.recordFailed(channel.name());
                logger.atError()
                        .setCause(e)
                        .addArgument(subscriber.name())
                        .addArgument(channel.name())
                        .log("Error in handler '{}' for channel '{}'");
                notifyError(subscriber, e);
                continue;
            }
            broker.recordConsumed(channel.name());
            reply(envelope, result);
        }
    }

    private void notifyError(MessageSubscriber subscriber, Throwable error) {
        try {
            subscriber.onError(error);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(subscriber.name())
                    .log("Error handler of '{}' failed");
        }
    }

    private void reply(Envelope envelope, Map<String, Object> result) {
        String replyTo = envelope.replyTo();
        if (replyTo == null || result == null || result.isEmpty()) {
            return;
        }
        Map<String, String> headers = new HashMap<>();
        if (envelope.correlationId() != null) {
            headers.put(Envelope.CORRELATION_ID, envelope.correlationId());
        }
        try {
            broker.publish(replyTo, result, headers);
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(replyTo)
                    .addArgument(channel.name())
                    .log("Could not send reply to {} for a message on {}");
        }
    }
}
