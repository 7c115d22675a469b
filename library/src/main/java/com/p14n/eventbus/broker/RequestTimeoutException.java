package com.p14n.eventbus.broker;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * No reply arrived for a request within its timeout. The request itself is not
 * withdrawn from the target channel.
 */
public class RequestTimeoutException extends TimeoutException {

    private final String channel;
    private final String correlationId;
    private final Duration timeout;

    public RequestTimeoutException(String channel, String correlationId, Duration timeout) {
        super("No reply on channel '" + channel + "' within " + timeout.toMillis() + "ms (correlation id "
                + correlationId + ")");
        this.channel = channel;
        this.correlationId = correlationId;
        this.timeout = timeout;
    }

    public String channel() {
        return channel;
    }

    public String correlationId() {
        return correlationId;
    }

    public Duration timeout() {
        return timeout;
    }
}
