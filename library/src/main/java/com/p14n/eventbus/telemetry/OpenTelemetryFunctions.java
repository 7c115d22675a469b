package com.p14n.eventbus.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        public static final String TRACEPARENT = "traceparent";

        private OpenTelemetryFunctions() {
        }

        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(TRACEPARENT);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                Map<String, String> carrier = new HashMap<>();
                carrier.put(TRACEPARENT, traceparent);
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), carrier,
                                new MapTextMapGetter());
        }

        /**
         * Adds the current trace context to a copy of the given headers, unless a
         * traceparent is already present or there is no active trace.
         */
        public static Map<String, String> withTraceContext(OpenTelemetry ot, Map<String, String> headers) {
                Map<String, String> result = headers == null ? new HashMap<>() : new HashMap<>(headers);
                if (!result.containsKey(TRACEPARENT)) {
                        String traceparent = serializeTraceContext(ot);
                        if (traceparent != null) {
                                result.put(TRACEPARENT, traceparent);
                        }
                }
                return result;
        }

        /**
         * Runs the action inside a span named after the operation, parented on the
         * traceparent header when one is given. Exceptions are recorded on the span and
         * rethrown unchanged.
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String channel,
                        String subscriber, Map<String, String> headers, Callable<T> action) throws Exception {

                String traceparent = headers == null ? null : headers.get(TRACEPARENT);
                Context parentContext = traceparent == null ? null
                                : OpenTelemetryFunctions.deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("channel", channel)
                                .setAttribute("subscriber", subscriber);
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.call();
                } catch (Exception | Error e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
