package com.p14n.eventbus;

import java.util.Map;

import com.p14n.eventbus.broker.MessageSubscriber;
import com.p14n.eventbus.data.EventCodec;

/**
 * Adapts an {@link EventHandler} to a broker subscriber: every flat record is
 * decoded into the handler's event class before the handler runs.
 */
class DecodingSubscriber<E> implements MessageSubscriber {

    private final Class<E> eventClass;
    private final EventHandler<E> handler;

    DecodingSubscriber(Class<E> eventClass, EventHandler<E> handler) {
        this.eventClass = eventClass;
        this.handler = handler;
    }

    @Override
    public Map<String, Object> onMessage(Map<String, Object> message) throws Exception {
        handler.handle(EventCodec.decode(message, eventClass));
        return null;
    }

    @Override
    public String name() {
        return handler.name();
    }

    Class<?> handlerClass() {
        return handler.getClass();
    }
}
