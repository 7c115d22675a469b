package com.p14n.eventbus.broker;

public record SubscriberInfo(String name, String channel) {
}
