package com.p14n.eventbus.broker;

/**
 * Handle for one registration of a subscriber on a channel. Registering the
 * same subscriber twice yields two distinct handles.
 */
public final class Subscription {

    private final String channel;
    private final MessageSubscriber subscriber;

    Subscription(String channel, MessageSubscriber subscriber) {
        this.channel = channel;
        this.subscriber = subscriber;
    }

    public String channel() {
        return channel;
    }

    public MessageSubscriber subscriber() {
        return subscriber;
    }

    @Override
    public String toString() {
        return "Subscription[" + channel + " -> " + subscriber.name() + "]";
    }
}
