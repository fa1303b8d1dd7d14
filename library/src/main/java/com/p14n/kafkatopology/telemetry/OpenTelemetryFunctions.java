package com.p14n.kafkatopology.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String entityType,
                                                 String entityId,
                                                 Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                        .setAttribute("entity.type", entityType)
                        .setAttribute("entity.id", entityId);
                return inSpan(sb.startSpan(), action);
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                                                 Supplier<T> action) {

                return inSpan(tracer.spanBuilder(spanName).startSpan(), action);
        }

        private static <T> T inSpan(Span span, Supplier<T> action) {
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }

}
