package com.p14n.eventbus.data;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the event type carried by a typed event class, so handlers can be
 * registered with the class alone.
 *
 * <pre>{@code
 * @EventType("order.created")
 * public record OrderCreated(...) implements ScopedEvent { ... }
 *
 * eventBus.subscribe(OrderCreated.class, event -> ...);
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EventType {

    /**
     * @return the event type, for example {@code order.created}
     */
    String value();
}
