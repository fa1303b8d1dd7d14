package com.p14n.kafkatopology;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ResourceAttributes;

public class Opentelemetry {

        public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

        private Opentelemetry() {
        }

        public static OpenTelemetrySdk create(String serviceName, String endpoint) {
                Resource resource = Resource.create(Attributes.of(ResourceAttributes.SERVICE_NAME, serviceName));

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(endpoint)
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }

        /**
         * Telemetry is exported only when {@code OTEL_EXPORTER_OTLP_ENDPOINT} is
         * set; otherwise a no-op instance is returned.
         */
        public static OpenTelemetry fromEnvironment(String serviceName) {
                String endpoint = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
                if (endpoint == null || endpoint.isBlank()) {
                        return OpenTelemetry.noop();
                }
                return create(serviceName, endpoint);
        }
}
