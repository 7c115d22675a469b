package com.p14n.eventbus.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery scope of an event.
 * <ul>
 * <li>{@code PROCESS}: handled only inside the current process</li>
 * <li>{@code APP}: distributed to every instance of the application</li>
 * </ul>
 */
public enum EventScope {
    PROCESS("process"),
    APP("app");

    private final String value;

    EventScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventScope fromValue(String value) {
        for (EventScope scope : values()) {
            if (scope.value.equalsIgnoreCase(value) || scope.name().equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown event scope: " + value);
    }
}
