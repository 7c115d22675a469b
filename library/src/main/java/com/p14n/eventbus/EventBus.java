package com.p14n.eventbus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbus.broker.MessageBroker;
import com.p14n.eventbus.broker.MessageSubscriber;
import com.p14n.eventbus.broker.PublishResult;
import com.p14n.eventbus.broker.Subscription;
import com.p14n.eventbus.data.EventCodec;
import com.p14n.eventbus.data.EventScope;
import com.p14n.eventbus.data.ScopedEvent;

/**
 * Routes events to one of two brokers according to their scope.
 *
 * <p>
 * {@link EventScope#PROCESS} events go to the local broker only and
 * {@link EventScope#APP} events to the distributed broker only. Handlers are
 * registered on both brokers, under the channel {@code events.<type>}, so they
 * see events of either scope.
 * </p>
 *
 * <p>
 * Publishing is fire-and-forget: a broker failure is logged and never reaches
 * the caller.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * try (var bus = new EventBus(localBroker, distributedBroker)) {
 *     bus.subscribe("order.created", Event.class, event -> ...);
 *     bus.start();
 *     bus.publish(Event.create("shop", "order.created", Map.of("order_id", "ORD-001"),
 *             EventScope.PROCESS));
 * }
 * }</pre>
 */
public class EventBus implements AutoCloseable {

    private final MessageBroker local;
    private final MessageBroker distributed;
    private final Logger logger;

    private final Map<String, List<MessageSubscriber>> handlers = new LinkedHashMap<>();

    /**
     * Creates an event bus logging through its own class logger.
     *
     * @param local       broker for process scoped events
     * @param distributed broker for application scoped events
     * @throws IllegalArgumentException if either broker is null
     */
    public EventBus(MessageBroker local, MessageBroker distributed) {
        this(local, distributed, null);
    }

    /**
     * Creates an event bus logging through the given logger.
     *
     * @param local       broker for process scoped events
     * @param distributed broker for application scoped events
     * @param logger      logger to use, or null for the default
     * @throws IllegalArgumentException if either broker is null
     */
    public EventBus(MessageBroker local, MessageBroker distributed, Logger logger) {
        if (local == null) {
            throw new IllegalArgumentException("local broker cannot be null");
        }
        if (distributed == null) {
            throw new IllegalArgumentException("distributed broker cannot be null");
        }
        this.local = local;
        this.distributed = distributed;
        this.logger = logger != null ? logger : LoggerFactory.getLogger(EventBus.class);
    }

    /**
     * Starts the local broker, then the distributed one. When the distributed
     * broker fails the local broker is stopped again before the failure is
     * rethrown.
     */
    public void start() {
        logger.atInfo().log("Starting event bus");
        try {
            local.start();
            logger.atInfo().log("Local broker started");
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start local broker");
            throw e;
        }

        try {
            distributed.start();
            logger.atInfo().log("Distributed broker started");
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start distributed broker");
            try {
                local.stop();
            } catch (RuntimeException stopFailure) {
                e.addSuppressed(stopFailure);
            }
            throw e;
        }

        logger.atInfo().log("Event bus started");
    }

    /**
     * Stops both brokers, attempting each even if the other fails.
     *
     * @throws EventBusException carrying every failure, if any broker failed to
     *                           stop
     */
    public void stop() {
        logger.atInfo().log("Stopping event bus");
        List<RuntimeException> errors = new ArrayList<>();

        try {
            local.stop();
            logger.atInfo().log("Local broker stopped");
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to stop local broker");
            errors.add(e);
        }

        try {
            distributed.stop();
            logger.atInfo().log("Distributed broker stopped");
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to stop distributed broker");
            errors.add(e);
        }

        if (!errors.isEmpty()) {
            logger.atError()
                    .addArgument(errors.size())
                    .log("Event bus stopped with {} error(s)");
            throw new EventBusException("Failed to stop " + errors.size() + " broker(s)", errors);
        }
        logger.atInfo().log("Event bus stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Registers a subscriber for an event type on both brokers. The subscriber
     * receives events as flat records.
     *
     * @param eventType  the event type, for example {@code order.created}
     * @param subscriber the subscriber
     * @return the registration on each broker
     */
    public EventSubscription subscribe(String eventType, MessageSubscriber subscriber) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        String channel = ScopedEvent.channelFor(eventType);

        Subscription onLocal = local.subscribe(channel, subscriber);
        Subscription onDistributed;
        try {
            onDistributed = distributed.subscribe(channel, subscriber);
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(eventType)
                    .log("Failed to register handler for event '{}' on distributed broker");
            try {
                local.unsubscribe(onLocal);
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        synchronized (handlers) {
            handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        }

        logger.atInfo()
                .addArgument(subscriber.name())
                .addArgument(eventType)
                .log("Registered handler '{}' for event '{}'");
        return new EventSubscription(eventType, subscriber, onLocal, onDistributed);
    }

    /**
     * Registers a typed handler. Every delivered record is decoded into
     * {@code eventClass} before the handler is called.
     */
    public <E> EventSubscription subscribe(String eventType, Class<E> eventClass, EventHandler<E> handler) {
        if (eventClass == null || handler == null) {
            throw new IllegalArgumentException("Event class and handler cannot be null");
        }
        return subscribe(eventType, new DecodingSubscriber<>(eventClass, handler));
    }

    /**
     * Registers a typed handler for the event type declared on {@code eventClass}
     * with {@link com.p14n.eventbus.data.EventType}.
     */
    public <E> EventSubscription subscribe(Class<E> eventClass, EventHandler<E> handler) {
        if (eventClass == null) {
            throw new IllegalArgumentException("Event class cannot be null");
        }
        return subscribe(EventCodec.eventTypeOf(eventClass), eventClass, handler);
    }

    /**
     * Publishes the event to the broker matching its scope. Failures are logged,
     * not thrown.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if the event is null
     */
    public void publish(ScopedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        boolean processScoped = event.scope() == EventScope.PROCESS;
        MessageBroker target = processScoped ? local : distributed;
        String brokerName = processScoped ? "local" : "distributed";
        try {
            String channel = event.channelName();
            logger.atDebug()
                    .addArgument(event.scope())
                    .addArgument(event.type())
                    .addArgument(channel)
                    .addArgument(brokerName)
                    .log("Publishing {} event '{}' to channel '{}' via {} broker");
            PublishResult result = target.publish(channel, event.toFlatRecord());
            if (!result.isAccepted()) {
                logger.atDebug()
                        .addArgument(event.type())
                        .addArgument(result.status())
                        .log("Event '{}' not delivered: {}");
            }
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(event.type())
                    .addArgument(brokerName)
                    .log("Failed to publish event '{}' to {} broker");
        }
    }

    /**
     * Returns the registered handlers per event type, in registration order.
     */
    public Map<String, List<HandlerInfo>> getHandlers() {
        Map<String, List<HandlerInfo>> result = new LinkedHashMap<>();
        synchronized (handlers) {
            handlers.forEach((eventType, subscribers) -> {
                List<HandlerInfo> infos = new ArrayList<>();
                for (MessageSubscriber subscriber : subscribers) {
                    infos.add(new HandlerInfo(subscriber.name(), handlerClass(subscriber).getName()));
                }
                result.put(eventType, List.copyOf(infos));
            });
        }
        return result;
    }

    private static Class<?> handlerClass(MessageSubscriber subscriber) {
        if (subscriber instanceof DecodingSubscriber<?> decoding) {
            return decoding.handlerClass();
        }
        return subscriber.getClass();
    }
}
