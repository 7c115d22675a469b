package com.p14n.eventbus.data;

import java.util.Map;

/**
 * Contract the event bus needs from an event: its type, its delivery scope and
 * a flat key/value form to hand to a broker.
 */
public interface ScopedEvent {

    /**
     * Returns the event type identifier, for example {@code order.created}.
     *
     * @return the event type
     */
    String type();

    /**
     * Returns the delivery scope of the event.
     *
     * @return the scope
     */
    EventScope scope();

    /**
     * Returns the broker channel the event is published on.
     *
     * @return {@code "events." + type()}
     */
    default String channelName() {
        return channelFor(type());
    }

    /**
     * Flattens the event into a single level record. Null fields are left out and
     * extension attributes are merged into the top level.
     *
     * @return the flat record
     */
    default Map<String, Object> toFlatRecord() {
        return EventCodec.flatten(this);
    }

    static String channelFor(String eventType) {
        return "events." + eventType;
    }
}
