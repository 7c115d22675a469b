package com.p14n.eventbus.broker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight request/response exchanges keyed by correlation id. An entry leaves
 * the table exactly once, either when it is fulfilled or when it expires.
 */
class PendingRequests {

    private final ConcurrentHashMap<String, CompletableFuture<Map<String, Object>>> pending = new ConcurrentHashMap<>();

    CompletableFuture<Map<String, Object>> register(String correlationId) {
        CompletableFuture<Map<String, Object>> future = new CompletableFuture<>();
        if (pending.putIfAbsent(correlationId, future) != null) {
            throw new IllegalStateException("Correlation id already in flight: " + correlationId);
        }
        return future;
    }

    /**
     * Fulfils the exchange. A reply for an unknown, fulfilled or expired id is
     * ignored.
     *
     * @return true if this call fulfilled the exchange
     */
    boolean complete(String correlationId, Map<String, Object> reply) {
        CompletableFuture<Map<String, Object>> future = pending.remove(correlationId);
        return future != null && future.complete(reply);
    }

    /**
     * @return true if the entry was still pending and is now removed
     */
    boolean expire(String correlationId) {
        return pending.remove(correlationId) != null;
    }

    boolean contains(String correlationId) {
        return pending.containsKey(correlationId);
    }

    int size() {
        return pending.size();
    }
}
