package com.p14n.eventbus.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenTelemetryFunctionsTest {

    private final OpenTelemetry ot = OpenTelemetry.noop();
    private final Tracer tracer = ot.getTracer("test");

    @Test
    void shouldCopyHeadersWithoutActiveTrace() {
        Map<String, String> headers = Map.of("correlation_id", "abc");

        Map<String, String> result = OpenTelemetryFunctions.withTraceContext(ot, headers);

        assertEquals(headers, result);
        assertNotSame(headers, result);
        assertTrue(OpenTelemetryFunctions.withTraceContext(ot, null).isEmpty());
    }

    @Test
    void shouldReturnActionResult() throws Exception {
        String result = OpenTelemetryFunctions.processWithTelemetry(ot, tracer, "process_message", "events.test",
                "handler", Map.of(OpenTelemetryFunctions.TRACEPARENT,
                        "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01"),
                () -> "done");

        assertEquals("done", result);
    }

    @Test
    void shouldRethrowActionFailure() {
        IllegalStateException failure = new IllegalStateException("boom");

        Exception thrown = assertThrows(Exception.class,
                () -> OpenTelemetryFunctions.processWithTelemetry(ot, tracer, "process_message", "events.test",
                        "handler", null, () -> {
                            throw failure;
                        }));

        assertSame(failure, thrown);
    }

    @Test
    void shouldRethrowErrors() {
        AssertionError failure = new AssertionError("boom");

        AssertionError thrown = assertThrows(AssertionError.class,
                () -> OpenTelemetryFunctions.processWithTelemetry(ot, tracer, "process_message", "events.test",
                        "handler", null, () -> {
                            throw failure;
                        }));

        assertSame(failure, thrown);
    }

    @Test
    void shouldReadHeadersThroughGetter() {
        MapTextMapGetter getter = new MapTextMapGetter();

        assertEquals("v", getter.get(Map.of("k", "v"), "k"));
        assertNull(getter.get(null, "k"));
    }
}
