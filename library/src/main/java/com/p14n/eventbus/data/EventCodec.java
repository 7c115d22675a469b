package com.p14n.eventbus.data;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Converts events to and from the flat key/value records carried by brokers.
 */
public class EventCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private EventCodec() {
    }

    /**
     * Flattens an event into a record. Null fields are dropped and an
     * {@code extensions} map, when present, is merged into the top level.
     */
    public static Map<String, Object> flatten(Object event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Map<String, Object> record = mapper.convertValue(event, RECORD_TYPE);
        Object extensions = record.remove("extensions");
        if (extensions instanceof Map<?, ?> ext) {
            ext.forEach((k, v) -> record.put(String.valueOf(k), v));
        }
        return record;
    }

    /**
     * Decodes a flat record into the given event class. {@link Event} keeps
     * unknown keys as extensions, other classes ignore them.
     *
     * @throws IllegalArgumentException if the record cannot be converted
     */
    @SuppressWarnings("unchecked")
    public static <E> E decode(Map<String, Object> record, Class<E> eventClass) {
        if (eventClass == Event.class) {
            return (E) Event.fromFlatRecord(record);
        }
        return mapper.convertValue(record, eventClass);
    }

    /**
     * Reads the event type declared with {@link EventType} on a typed event
     * class.
     *
     * @throws IllegalArgumentException if the class carries no event type
     */
    public static String eventTypeOf(Class<?> eventClass) {
        EventType annotation = eventClass.getAnnotation(EventType.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalArgumentException("Event class " + eventClass.getSimpleName()
                    + " must declare its type with @EventType");
        }
        return annotation.value();
    }
}
