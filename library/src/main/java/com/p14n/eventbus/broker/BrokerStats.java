package com.p14n.eventbus.broker;

import java.util.Map;

/**
 * Point-in-time snapshot of a broker's counters and channel table.
 */
public record BrokerStats(long published,
        long consumed,
        long errors,
        boolean running,
        int channels,
        int subscribers,
        Map<String, Integer> queueSizes) {

    public BrokerStats {
        queueSizes = Map.copyOf(queueSizes);
    }
}
