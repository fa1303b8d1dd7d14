package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.client.BrokerClientException;
import com.p14n.kafkatopology.client.FlushResult;
import com.p14n.kafkatopology.client.TopicHandle;
import com.p14n.kafkatopology.connection.ClusterConnection;
import com.p14n.kafkatopology.data.Topic;
import com.p14n.kafkatopology.telemetry.ResolutionMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Binds topics to open connections and probes them with a canary send.
 */
public class TopicBinder {

    private static final Logger logger = LoggerFactory.getLogger(TopicBinder.class);

    public static final byte[] PROBE_PAYLOAD = "test".getBytes(StandardCharsets.US_ASCII);
    public static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(10);
    public static final ProbeFlushPolicy DEFAULT_FLUSH_POLICY = ProbeFlushPolicy.FAIL_ON_FLUSH_ERROR;

    private final BindingRegistry registry;
    private final ResolutionMetrics metrics;
    private final ProbeFlushPolicy flushPolicy;

    public TopicBinder(BindingRegistry registry, ResolutionMetrics metrics) {
        this(registry, metrics, DEFAULT_FLUSH_POLICY);
    }

    public TopicBinder(BindingRegistry registry, ResolutionMetrics metrics, ProbeFlushPolicy flushPolicy) {
        this.registry = registry;
        this.metrics = metrics;
        this.flushPolicy = flushPolicy;
    }

    public ProbeFlushPolicy flushPolicy() {
        return flushPolicy;
    }

    /**
     * Creates a topic handle under the connection. The returned binding holds
     * the caller's reference; the caller must {@link TopicBinding#release()}
     * it.
     *
     * @param connection an open connection
     * @param topic      the topic to bind
     * @return the binding
     * @throws BindException if the library cannot create the topic handle
     */
    public TopicBinding bind(ClusterConnection connection, Topic topic) throws BindException {
        TopicBinding binding = new TopicBinding(connection, topic, registry, metrics);
        long id = registry.register(binding);

        TopicHandle handle;
        try {
            handle = connection.client().createTopicHandle(connection.handle(), topic.topic(), id);
        } catch (BrokerClientException e) {
            registry.unregister(id, binding);
            binding.releaseReference();
            throw new BindException(e.getMessage(), e);
        }

        binding.bound(id, handle);
        connection.attach(binding);
        metrics.recordTopicBound(topic.topic());
        logger.atDebug()
                .addArgument(topic.id())
                .addArgument(topic.topic())
                .addArgument(connection.producerId())
                .log("Bound topic {} ({}) to producer {}");
        return binding;
    }

    /**
     * Sends {@link #PROBE_PAYLOAD} and flushes the owning connection within
     * {@link #FLUSH_TIMEOUT}.
     *
     * @param binding a live binding
     * @throws ProbeException if the send fails or the flush policy rejects
     *                        the flush result
     */
    public void probe(TopicBinding binding) throws ProbeException {
        try {
            binding.send(PROBE_PAYLOAD);
        } catch (BrokerClientException e) {
            throw new ProbeException(e.getMessage(), e);
        }
        metrics.recordProbeSent(binding.topic().topic());

        FlushResult result = binding.connection().flush(FLUSH_TIMEOUT);
        if (flushPolicy.isFailure(result)) {
            throw new ProbeException(result.isOk()
                    ? "Flush completed"
                    : result.cause());
        }
        logger.atDebug()
                .addArgument(binding.topic().id())
                .addArgument(result.status())
                .log("Probe of topic {} flushed with status {}");
    }
}
