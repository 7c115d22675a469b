package com.p14n.eventbus;

/**
 * Describes a registered handler for diagnostics.
 *
 * @param name      the handler name
 * @param className the class implementing the handler
 */
public record HandlerInfo(String name, String className) {
}
