package com.p14n.kafkatopology.telemetry;

import com.p14n.kafkatopology.FailureKind;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for topology resolution.
 *
 * <p>
 * This class provides five metrics:
 * </p>
 * <ul>
 * <li>connections_opened: Counter of producer connections opened per
 * cluster</li>
 * <li>topics_bound: Counter of topic bindings created per topic</li>
 * <li>probes_sent: Counter of probe payloads sent per topic</li>
 * <li>resolution_failures: Counter of failures per failure kind</li>
 * <li>active_bindings: Up/down counter of live topic bindings per topic</li>
 * </ul>
 */
public class ResolutionMetrics {

        private static final AttributeKey<String> CLUSTER = AttributeKey.stringKey("cluster");
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> KIND = AttributeKey.stringKey("kind");

        private final LongCounter connectionsOpened;
        private final LongCounter topicsBound;
        private final LongCounter probesSent;
        private final LongCounter failures;
        private final LongUpDownCounter activeBindings;

        /**
         * Creates a new ResolutionMetrics instance with the provided OpenTelemetry
         * meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public ResolutionMetrics(Meter meter) {
                connectionsOpened = meter.counterBuilder("connections_opened")
                                .setDescription("Number of producer connections opened")
                                .build();

                topicsBound = meter.counterBuilder("topics_bound")
                                .setDescription("Number of topic bindings created")
                                .build();

                probesSent = meter.counterBuilder("probes_sent")
                                .setDescription("Number of probe payloads sent")
                                .build();

                failures = meter.counterBuilder("resolution_failures")
                                .setDescription("Number of entities that failed to resolve")
                                .build();

                activeBindings = meter.upDownCounterBuilder("active_bindings")
                                .setDescription("Number of live topic bindings")
                                .build();
        }

        public void recordConnectionOpened(String clusterId) {
                connectionsOpened.add(1, Attributes.of(CLUSTER, clusterId));
        }

        /**
         * Records a new binding. Increments both the bound counter and the live
         * binding count for the topic.
         *
         * @param topic The wire-level topic name
         */
        public void recordTopicBound(String topic) {
                Attributes attributes = Attributes.of(TOPIC, topic);
                topicsBound.add(1, attributes);
                activeBindings.add(1, attributes);
        }

        public void recordBindingReleased(String topic) {
                activeBindings.add(-1, Attributes.of(TOPIC, topic));
        }

        public void recordProbeSent(String topic) {
                probesSent.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordFailure(FailureKind kind) {
                failures.add(1, Attributes.of(KIND, kind.name()));
        }
}
