package com.p14n.kafkatopology.resolver;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.TopologyException;
import com.p14n.kafkatopology.binding.BindException;
import com.p14n.kafkatopology.binding.BindingRegistry;
import com.p14n.kafkatopology.binding.ProbeException;
import com.p14n.kafkatopology.binding.ProbeFlushPolicy;
import com.p14n.kafkatopology.binding.TopicBinder;
import com.p14n.kafkatopology.binding.TopicBinding;
import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.connection.ClusterConnection;
import com.p14n.kafkatopology.connection.ClusterConnectionFactory;
import com.p14n.kafkatopology.connection.ConfigBuildException;
import com.p14n.kafkatopology.connection.ConnectionConfigBuilder;
import com.p14n.kafkatopology.data.Cluster;
import com.p14n.kafkatopology.data.Consumer;
import com.p14n.kafkatopology.data.Producer;
import com.p14n.kafkatopology.data.Topic;
import com.p14n.kafkatopology.store.EntityStore;
import com.p14n.kafkatopology.store.EntityStoreException;
import com.p14n.kafkatopology.telemetry.ResolutionMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.p14n.kafkatopology.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Walks the topology held by an {@link EntityStore} and materialises it:
 * clusters, then the producers and consumers of each cluster, then the
 * topics of each producer and consumer.
 *
 * <p>
 * A producer with topics gets one connection, shared by all of its topics.
 * Each topic is bound, probed and released before the next; the connection
 * is closed once all of them are done. A producer without topics opens
 * nothing. Consumer settings are validated by building and releasing their
 * cluster's configuration.
 * </p>
 *
 * <p>
 * Resolution is best effort. Every failure is logged, recorded in the
 * returned {@link ResolutionReport} against the entity that caused it, and
 * resolution continues with the next sibling.
 * </p>
 */
public class TopologyResolver {

    private static final Logger logger = LoggerFactory.getLogger(TopologyResolver.class);

    public static final String SCOPE_NAME = "com.p14n.kafkatopology";

    /** Report id used when a store query not tied to one entity fails. */
    public static final String ALL_ENTITIES = "*";

    private final EntityStore store;
    private final ConnectionConfigBuilder configBuilder;
    private final ClusterConnectionFactory connectionFactory;
    private final TopicBinder binder;
    private final ResolutionMetrics metrics;
    private final Tracer tracer;

    public TopologyResolver(EntityStore store, ConnectionConfigBuilder configBuilder,
            ClusterConnectionFactory connectionFactory, TopicBinder binder,
            ResolutionMetrics metrics, Tracer tracer) {
        this.store = store;
        this.configBuilder = configBuilder;
        this.connectionFactory = connectionFactory;
        this.binder = binder;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    public static TopologyResolver create(EntityStore store, BrokerClient client, OpenTelemetry ot) {
        return create(store, client, ot, TopicBinder.DEFAULT_FLUSH_POLICY);
    }

    /**
     * Wires a resolver with its own binding registry.
     *
     * @param store       the topology
     * @param client      the broker client
     * @param ot          telemetry
     * @param flushPolicy how probe flush results are judged
     * @return the resolver
     */
    public static TopologyResolver create(EntityStore store, BrokerClient client, OpenTelemetry ot,
            ProbeFlushPolicy flushPolicy) {
        ResolutionMetrics metrics = new ResolutionMetrics(ot.getMeter(SCOPE_NAME));
        BindingRegistry registry = new BindingRegistry();
        ConnectionConfigBuilder configBuilder = new ConnectionConfigBuilder(client);
        return new TopologyResolver(store,
                configBuilder,
                new ClusterConnectionFactory(client, configBuilder, registry, metrics),
                new TopicBinder(registry, metrics, flushPolicy),
                metrics,
                ot.getTracer(SCOPE_NAME));
    }

    /**
     * Runs one full resolution pass.
     *
     * @return what succeeded and what failed
     */
    public ResolutionReport resolveAll() {
        ResolutionReport.Builder report = ResolutionReport.builder();

        Optional<List<Cluster>> clusters = fetch(report, Stage.CLUSTER, ALL_ENTITIES,
                () -> store.retrieveAll(Cluster.class));
        if (clusters.isEmpty()) {
            return report.build();
        }

        for (Cluster cluster : clusters.get()) {
            processWithTelemetry(tracer, "resolve_cluster", "cluster", cluster.id(), () -> {
                resolveCluster(report, cluster);
                return null;
            });
        }

        sweepUnresolved(report, clusters.get());

        ResolutionReport result = report.build();
        logger.atInfo()
                .addArgument(clusters.get().size())
                .addArgument(result.successes().size())
                .addArgument(result.failures().size())
                .log("Resolved {} clusters: {} succeeded, {} failed");
        return result;
    }

    private void resolveCluster(ResolutionReport.Builder report, Cluster cluster) {
        logger.atDebug().addArgument(cluster.id()).log("Resolving cluster {}");

        fetch(report, Stage.CLUSTER, cluster.id(),
                () -> store.retrieveByField(Producer.class, EntityStore.FIELD_CLUSTER, cluster.id()))
                .ifPresent(producers -> producers.forEach(p -> resolveProducer(report, cluster, p)));

        fetch(report, Stage.CLUSTER, cluster.id(),
                () -> store.retrieveByField(Consumer.class, EntityStore.FIELD_CLUSTER, cluster.id()))
                .ifPresent(consumers -> consumers.forEach(c -> resolveConsumer(report, cluster, c)));
    }

    private void resolveProducer(ResolutionReport.Builder report, Cluster cluster, Producer producer) {
        Optional<List<Topic>> topics = fetch(report, Stage.PRODUCER, producer.id(),
                () -> store.retrieveByField(Topic.class, EntityStore.FIELD_PRODUCER, producer.id()));
        if (topics.isEmpty()) {
            return;
        }
        if (topics.get().isEmpty()) {
            logger.atDebug()
                    .addArgument(producer.id())
                    .log("Producer {} has no topics, not connecting");
            return;
        }

        try (ClusterConnection connection = connectionFactory.open(cluster, producer.id())) {
            for (Topic topic : topics.get()) {
                bindAndProbe(report, connection, topic);
            }
        } catch (ConfigBuildException e) {
            fail(report, Stage.CLUSTER, cluster.id(), e);
        } catch (TopologyException e) {
            fail(report, Stage.PRODUCER, producer.id(), e);
        }
    }

    private void bindAndProbe(ResolutionReport.Builder report, ClusterConnection connection, Topic topic) {
        TopicBinding binding;
        try {
            binding = binder.bind(connection, topic);
        } catch (BindException e) {
            fail(report, Stage.PRODUCER_TOPIC, topic.id(), e);
            return;
        }
        try {
            binder.probe(binding);
            report.success(Stage.PRODUCER_TOPIC, topic.id());
        } catch (ProbeException e) {
            fail(report, Stage.PRODUCER_TOPIC, topic.id(), e);
        } finally {
            binding.release();
        }
    }

    private void resolveConsumer(ResolutionReport.Builder report, Cluster cluster, Consumer consumer) {
        try {
            BrokerConfig config = configBuilder.build(cluster);
            config.release();
        } catch (ConfigBuildException e) {
            fail(report, Stage.CLUSTER, cluster.id(), e);
            return;
        }

        fetch(report, Stage.CONSUMER, consumer.id(),
                () -> store.retrieveByField(Topic.class, EntityStore.FIELD_CONSUMER, consumer.id()))
                .ifPresent(topics -> topics.forEach(t -> report.success(Stage.CONSUMER_TOPIC, t.id())));
    }

    private void sweepUnresolved(ResolutionReport.Builder report, List<Cluster> clusters) {
        Set<String> clusterIds = ids(clusters, Cluster::id);

        Optional<List<Producer>> producers = fetch(report, Stage.PRODUCER, ALL_ENTITIES,
                () -> store.retrieveAll(Producer.class));
        producers.ifPresent(all -> all.stream()
                .filter(p -> !clusterIds.contains(p.clusterId()))
                .forEach(p -> unresolved(report, Stage.PRODUCER, p.id(), "cluster", p.clusterId())));

        Optional<List<Consumer>> consumers = fetch(report, Stage.CONSUMER, ALL_ENTITIES,
                () -> store.retrieveAll(Consumer.class));
        consumers.ifPresent(all -> all.stream()
                .filter(c -> !clusterIds.contains(c.clusterId()))
                .forEach(c -> unresolved(report, Stage.CONSUMER, c.id(), "cluster", c.clusterId())));

        Optional<List<Topic>> topics = fetch(report, Stage.PRODUCER_TOPIC, ALL_ENTITIES,
                () -> store.retrieveAll(Topic.class));
        if (topics.isEmpty() || producers.isEmpty() || consumers.isEmpty()) {
            return;
        }
        Set<String> producerIds = ids(producers.get(), Producer::id);
        Set<String> consumerIds = ids(consumers.get(), Consumer::id);
        for (Topic topic : topics.get()) {
            if (topic.hasProducer() && !producerIds.contains(topic.producerId())) {
                unresolved(report, Stage.PRODUCER_TOPIC, topic.id(), "producer", topic.producerId());
            }
            if (topic.hasConsumer() && !consumerIds.contains(topic.consumerId())) {
                unresolved(report, Stage.CONSUMER_TOPIC, topic.id(), "consumer", topic.consumerId());
            }
        }
    }

    private void unresolved(ResolutionReport.Builder report, Stage stage, String id, String refType, String ref) {
        String cause = ref.isEmpty()
                ? "No " + refType + " configured"
                : "Unknown " + refType + " '" + ref + "'";
        record(report, stage, id, FailureKind.UNRESOLVED_REFERENCE, cause, Level.WARN);
    }

    private <T> Optional<List<T>> fetch(ResolutionReport.Builder report, Stage stage, String id,
            Supplier<List<T>> query) {
        try {
            return Optional.of(query.get());
        } catch (EntityStoreException e) {
            fail(report, stage, id, FailureKind.STORE, e.getMessage());
            return Optional.empty();
        }
    }

    private void fail(ResolutionReport.Builder report, Stage stage, String id, TopologyException e) {
        fail(report, stage, id, e.failureKind(), e.getMessage());
    }

    private void fail(ResolutionReport.Builder report, Stage stage, String id, FailureKind kind, String cause) {
        record(report, stage, id, kind, cause, Level.ERROR);
    }

    private void record(ResolutionReport.Builder report, Stage stage, String id, FailureKind kind, String cause,
            Level level) {
        logger.atLevel(level)
                .addArgument(kind)
                .addArgument(stage)
                .addArgument(id)
                .addArgument(cause)
                .log("{} failure resolving {} '{}': {}");
        metrics.recordFailure(kind);
        report.failure(stage, id, kind, cause);
    }

    private static <T> Set<String> ids(List<T> entities, Function<T, String> id) {
        return entities.stream().map(id).collect(Collectors.toSet());
    }
}
