package com.p14n.eventbus.broker;

/**
 * Raised when a broker cannot change its lifecycle state, or a request fails
 * for a reason other than a timeout.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
