package com.p14n.eventbus.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Record representing a CloudEvents v1.0 shaped event with a delivery scope.
 *
 * <p>
 * Required attributes are {@code id}, {@code source}, {@code specversion} and
 * {@code type}. {@code extensions} holds any additional attributes; they are
 * flattened into the top level by {@link #toFlatRecord()} and collected back by
 * {@link #fromFlatRecord(Map)}.
 * </p>
 */
public record Event(String id,
                    String source,
                    String specversion,
                    String type,
                    String datacontenttype,
                    String dataschema,
                    String subject,
                    Instant time,
                    Map<String, Object> data,
                    Map<String, Object> extensions,
                    EventScope scope) implements ScopedEvent {

    public static final String SPEC_VERSION = "1.0";
    public static final String JSON_CONTENT_TYPE = "application/json";

    private static final Set<String> STANDARD_FIELDS = Set.of("id", "source", "specversion", "type",
            "datacontenttype", "dataschema", "subject", "time", "data", "scope");

    public Event {
        extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    /**
     * Creates an application scoped event with a generated id and the current
     * time.
     */
    public static Event create(String source, String type, Map<String, Object> data) {
        return create(source, type, data, EventScope.APP);
    }

    public static Event create(String source, String type, Map<String, Object> data, EventScope scope) {
        return create(null, source, type, null, data, null, scope);
    }

    /**
     * Creates a new Event, filling in defaults: a random UUID id, specversion
     * {@code 1.0}, content type {@code application/json}, the current time and
     * {@link EventScope#APP}.
     *
     * @throws IllegalArgumentException if source or type is null or empty
     */
    public static Event create(String id, String source, String type, String subject,
            Map<String, Object> data, Map<String, Object> extensions, EventScope scope) {
        return create(id, source, SPEC_VERSION, type, JSON_CONTENT_TYPE, null, subject, Instant.now(), data,
                extensions, scope);
    }

    public static Event create(String id, String source, String specversion, String type, String datacontenttype,
            String dataschema, String subject, Instant time, Map<String, Object> data,
            Map<String, Object> extensions, EventScope scope) {
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalArgumentException("source cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("type cannot be null or empty");
        }
        if (specversion == null || specversion.trim().isEmpty()) {
            throw new IllegalArgumentException("specversion cannot be null or empty");
        }
        String eventId = id == null || id.trim().isEmpty() ? UUID.randomUUID().toString() : id;
        return new Event(eventId, source, specversion, type, datacontenttype, dataschema, subject, time, data,
                extensions, scope == null ? EventScope.APP : scope);
    }

    public Event withScope(EventScope newScope) {
        return new Event(id, source, specversion, type, datacontenttype, dataschema, subject, time, data,
                extensions, newScope);
    }

    /**
     * Rebuilds an event from a flat record. Keys outside the standard attribute
     * set become extensions.
     *
     * @throws IllegalArgumentException if a required attribute is missing
     */
    @SuppressWarnings("unchecked")
    public static Event fromFlatRecord(Map<String, Object> record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Map<String, Object> extensions = new LinkedHashMap<>();
        record.forEach((key, value) -> {
            if (!STANDARD_FIELDS.contains(key)) {
                extensions.put(key, value);
            }
        });
        Object data = record.get("data");
        if (data != null && !(data instanceof Map)) {
            throw new IllegalArgumentException("data must be a record, got " + data.getClass().getSimpleName());
        }
        Object scope = record.get("scope");
        return create(
                asString(record.get("id")),
                asString(record.get("source")),
                record.containsKey("specversion") ? asString(record.get("specversion")) : SPEC_VERSION,
                asString(record.get("type")),
                asString(record.get("datacontenttype")),
                asString(record.get("dataschema")),
                asString(record.get("subject")),
                asInstant(record.get("time")),
                (Map<String, Object>) data,
                extensions,
                scope == null ? EventScope.APP
                        : scope instanceof EventScope s ? s : EventScope.fromValue(scope.toString()));
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Instant asInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return Instant.parse(value.toString());
    }
}
