package com.p14n.eventbus.broker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message in transit on a channel: the payload and its headers.
 *
 * @param payload the flat record delivered to subscribers
 * @param headers metadata, see {@link #REPLY_TO} and {@link #CORRELATION_ID}
 */
public record Envelope(Map<String, Object> payload, Map<String, String> headers) {

    public static final String REPLY_TO = "reply_to";
    public static final String CORRELATION_ID = "correlation_id";

    public Envelope {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String replyTo() {
        String replyTo = headers.get(REPLY_TO);
        return replyTo == null || replyTo.isBlank() ? null : replyTo;
    }

    public String correlationId() {
        return headers.get(CORRELATION_ID);
    }
}
