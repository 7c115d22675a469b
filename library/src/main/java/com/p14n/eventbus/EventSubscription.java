package com.p14n.eventbus;

import com.p14n.eventbus.broker.MessageSubscriber;
import com.p14n.eventbus.broker.Subscription;

/**
 * Result of registering a handler on the event bus: the registration on each
 * broker.
 */
public record EventSubscription(String eventType,
        MessageSubscriber subscriber,
        Subscription local,
        Subscription distributed) {
}
