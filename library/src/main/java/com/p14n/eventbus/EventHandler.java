package com.p14n.eventbus;

/**
 * Handler for typed events. The event bus decodes the flat record delivered by
 * the broker into {@code E} before calling it.
 *
 * @param <E> the event class
 */
@FunctionalInterface
public interface EventHandler<E> {

    void handle(E event) throws Exception;

    default String name() {
        return getClass().getName();
    }

    static <E> EventHandler<E> named(String name, EventHandler<E> delegate) {
        if (name == null || delegate == null) {
            throw new IllegalArgumentException("Name and handler cannot be null");
        }
        return new EventHandler<>() {
            @Override
            public void handle(E event) throws Exception {
                delegate.handle(event);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
