package com.p14n.eventbus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;

import com.p14n.eventbus.broker.MessageBroker;
import com.p14n.eventbus.broker.MessageSubscriber;
import com.p14n.eventbus.data.EventCodec;

/**
 * Optional process-wide event bus for code that declares handlers before the
 * brokers exist.
 *
 * <p>
 * Registrations made before {@link #init} are kept in a backlog and applied, in
 * declaration order, when the bus is initialised; later registrations go
 * straight to the bus. Prefer passing an {@link EventBus} around explicitly.
 * </p>
 */
public final class GlobalEventBus {

    private static final Object lock = new Object();
    private static final List<Consumer<EventBus>> pending = new ArrayList<>();
    private static EventBus instance;

    private GlobalEventBus() {
    }

    public static EventBus init(MessageBroker local, MessageBroker distributed) {
        return init(local, distributed, null);
    }

    /**
     * Creates the global event bus and applies the pending registrations.
     *
     * @throws IllegalStateException if the bus is already initialised
     */
    public static EventBus init(MessageBroker local, MessageBroker distributed, Logger logger) {
        synchronized (lock) {
            if (instance != null) {
                throw new IllegalStateException("Global event bus is already initialised");
            }
            EventBus bus = new EventBus(local, distributed, logger);
            for (Consumer<EventBus> registration : pending) {
                registration.accept(bus);
            }
            pending.clear();
            instance = bus;
            return bus;
        }
    }

    public static Optional<EventBus> current() {
        synchronized (lock) {
            return Optional.ofNullable(instance);
        }
    }

    public static void register(String eventType, MessageSubscriber subscriber) {
        if (eventType == null || eventType.isBlank() || subscriber == null) {
            throw new IllegalArgumentException("eventType and subscriber are required");
        }
        apply(bus -> bus.subscribe(eventType, subscriber));
    }

    public static <E> void register(String eventType, Class<E> eventClass, EventHandler<E> handler) {
        if (eventType == null || eventType.isBlank() || eventClass == null || handler == null) {
            throw new IllegalArgumentException("eventType, event class and handler are required");
        }
        apply(bus -> bus.subscribe(eventType, eventClass, handler));
    }

    /**
     * Registers a typed handler for the type declared on the event class. The
     * declaration is checked immediately, even when the registration is deferred.
     */
    public static <E> void register(Class<E> eventClass, EventHandler<E> handler) {
        if (eventClass == null) {
            throw new IllegalArgumentException("Event class cannot be null");
        }
        register(EventCodec.eventTypeOf(eventClass), eventClass, handler);
    }

    private static void apply(Consumer<EventBus> registration) {
        synchronized (lock) {
            if (instance != null) {
                registration.accept(instance);
            } else {
                pending.add(registration);
            }
        }
    }

    static int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Forgets the global bus and the backlog. The brokers are left as they are.
     */
    public static void reset() {
        synchronized (lock) {
            instance = null;
            pending.clear();
        }
    }
}
