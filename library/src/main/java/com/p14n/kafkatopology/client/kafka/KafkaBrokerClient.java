package com.p14n.kafkatopology.client.kafka;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.BrokerClientException;
import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.client.DeliveryCallback;
import com.p14n.kafkatopology.client.DeliveryReport;
import com.p14n.kafkatopology.client.FlushResult;
import com.p14n.kafkatopology.client.ProducerHandle;
import com.p14n.kafkatopology.client.TopicHandle;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.internals.Topic;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.utils.AppInfoParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@link BrokerClient} backed by the Apache Kafka Java client.
 *
 * <p>
 * Kafka's producer has no topic objects and an unbounded {@code flush()};
 * this adapter supplies both. Topic handles are lightweight name/opaque
 * pairs validated with Kafka's topic naming rules, and each producer gets a
 * dedicated flush thread so a flush can be abandoned after its timeout.
 * </p>
 *
 * <p>
 * Delivery reports arrive on the producer's I/O thread and are forwarded to
 * the {@link DeliveryCallback} registered on the configuration the producer
 * was opened with.
 * </p>
 */
public class KafkaBrokerClient implements BrokerClient {

    private static final Logger logger = LoggerFactory.getLogger(KafkaBrokerClient.class);

    /** Upper bound on waiting for in-flight messages when a producer closes. */
    public static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final Function<Properties, Producer<byte[], byte[]>> producerFactory;

    public KafkaBrokerClient() {
        this(props -> new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer()));
    }

    /**
     * @param producerFactory creates the producer for a set of properties
     */
    public KafkaBrokerClient(Function<Properties, Producer<byte[], byte[]>> producerFactory) {
        this.producerFactory = producerFactory;
    }

    @Override
    public String version() {
        return AppInfoParser.getVersion();
    }

    @Override
    public BrokerConfig newConfig() {
        return new KafkaBrokerConfig();
    }

    @Override
    public ProducerHandle open(BrokerConfig config) throws BrokerClientException {
        if (!(config instanceof KafkaBrokerConfig kafkaConfig)) {
            throw new IllegalArgumentException("Not a Kafka configuration: " + config);
        }
        Producer<byte[], byte[]> producer;
        try {
            producer = producerFactory.apply(kafkaConfig.toProperties());
        } catch (KafkaException e) {
            throw new BrokerClientException(rootMessage(e), e);
        }
        ExecutorService flushExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("kafka-topology-flush-%d")
                        .setDaemon(true)
                        .build());
        logger.atDebug().log("Opened Kafka producer");
        return new KafkaProducerHandle(producer, kafkaConfig.deliveryCallback(), flushExecutor);
    }

    @Override
    public void close(ProducerHandle handle) {
        KafkaProducerHandle h = producerHandle(handle);
        if (!h.markClosed()) {
            return;
        }
        h.flushExecutor().shutdownNow();
        try {
            h.producer().close(CLOSE_TIMEOUT);
        } catch (KafkaException e) {
            logger.atWarn().setCause(e).log("Error closing Kafka producer");
        }
        logger.atDebug().log("Closed Kafka producer");
    }

    @Override
    public TopicHandle createTopicHandle(ProducerHandle handle, String topicName, long opaque)
            throws BrokerClientException {
        KafkaProducerHandle h = producerHandle(handle);
        if (h.isClosed()) {
            throw new BrokerClientException("Producer is closed");
        }
        try {
            Topic.validate(topicName);
        } catch (InvalidTopicException e) {
            throw new BrokerClientException(e.getMessage(), e);
        }
        return new KafkaTopicHandle(h, topicName, opaque);
    }

    @Override
    public void send(TopicHandle topic, byte[] payload) throws BrokerClientException {
        KafkaTopicHandle t = topicHandle(topic);
        if (t.isDestroyed()) {
            throw new BrokerClientException("Topic handle for " + t.topicName() + " has been destroyed");
        }
        KafkaProducerHandle h = t.producer();
        if (h.isClosed()) {
            throw new BrokerClientException("Producer is closed");
        }
        DeliveryCallback callback = h.deliveryCallback();
        try {
            h.producer().send(new ProducerRecord<>(t.topicName(), payload.clone()), (metadata, exception) -> {
                if (callback == null) {
                    return;
                }
                DeliveryReport report = exception == null
                        ? DeliveryReport.delivered(metadata.topic(), metadata.partition(), metadata.offset())
                        : DeliveryReport.failed(t.topicName(), rootMessage(exception));
                try {
                    callback.onDelivery(t.opaque(), report);
                } catch (RuntimeException e) {
                    logger.atWarn()
                            .setCause(e)
                            .addArgument(t.topicName())
                            .log("Delivery callback for topic {} failed");
                }
            });
        } catch (KafkaException | IllegalStateException e) {
            throw new BrokerClientException(rootMessage(e), e);
        }
    }

    @Override
    public FlushResult flush(ProducerHandle handle, Duration timeout) {
        KafkaProducerHandle h = producerHandle(handle);
        if (h.isClosed()) {
            return FlushResult.failed("Producer is closed");
        }
        Future<?> flushing = h.flushExecutor().submit(() -> h.producer().flush());
        try {
            flushing.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return FlushResult.ok();
        } catch (TimeoutException e) {
            flushing.cancel(true);
            return FlushResult.timedOut("Flush did not complete within " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return FlushResult.failed(rootMessage(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flushing.cancel(true);
            return FlushResult.failed("Interrupted while flushing");
        }
    }

    @Override
    public void destroyTopicHandle(TopicHandle topic) {
        topicHandle(topic).markDestroyed();
    }

    private static KafkaProducerHandle producerHandle(ProducerHandle handle) {
        if (handle instanceof KafkaProducerHandle h) {
            return h;
        }
        throw new IllegalArgumentException("Not a Kafka producer handle: " + handle);
    }

    private static KafkaTopicHandle topicHandle(TopicHandle topic) {
        if (topic instanceof KafkaTopicHandle t) {
            return t;
        }
        throw new IllegalArgumentException("Not a Kafka topic handle: " + topic);
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
