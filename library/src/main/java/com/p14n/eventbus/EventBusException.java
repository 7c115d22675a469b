package com.p14n.eventbus;

import java.util.List;

/**
 * Raised when the event bus could not stop every broker. Each broker failure is
 * attached as a suppressed exception.
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message, List<? extends Throwable> failures) {
        super(message, failures.isEmpty() ? null : failures.get(0));
        for (Throwable failure : failures) {
            addSuppressed(failure);
        }
    }

    public List<Throwable> failures() {
        return List.of(getSuppressed());
    }
}
