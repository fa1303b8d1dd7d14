package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.client.BrokerClientException;
import com.p14n.kafkatopology.client.DeliveryReport;
import com.p14n.kafkatopology.client.TopicHandle;
import com.p14n.kafkatopology.connection.ClusterConnection;
import com.p14n.kafkatopology.connection.ConnectionResource;
import com.p14n.kafkatopology.data.Topic;
import com.p14n.kafkatopology.telemetry.ResolutionMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A topic handle created under a {@link ClusterConnection}.
 *
 * <p>
 * The binding is reference counted. The creator holds one reference and the
 * {@link BindingRegistry} slot whose id the library carries as its opaque
 * value holds another. {@link #release()} tears down in a fixed order: the
 * topic handle is destroyed, then the registry slot and its reference are
 * dropped, then the creator's reference.
 * </p>
 */
public class TopicBinding implements ConnectionResource {

    private static final Logger logger = LoggerFactory.getLogger(TopicBinding.class);

    private final ClusterConnection connection;
    private final Topic topic;
    private final BindingRegistry registry;
    private final ResolutionMetrics metrics;
    private final AtomicInteger references = new AtomicInteger(1);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();

    private volatile TopicHandle handle;
    private volatile long registryId;

    TopicBinding(ClusterConnection connection, Topic topic, BindingRegistry registry, ResolutionMetrics metrics) {
        this.connection = connection;
        this.topic = topic;
        this.registry = registry;
        this.metrics = metrics;
    }

    void bound(long registryId, TopicHandle handle) {
        this.registryId = registryId;
        this.handle = handle;
    }

    public Topic topic() {
        return topic;
    }

    public ClusterConnection connection() {
        return connection;
    }

    public int referenceCount() {
        return references.get();
    }

    public boolean isReleased() {
        return released.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedDeliveryCount() {
        return failedDeliveries.get();
    }

    /**
     * Sends a payload through the topic handle.
     *
     * @param payload the bytes to send
     * @throws BrokerClientException if the library rejects the send
     * @throws IllegalStateException if the binding or its connection is gone
     */
    public void send(byte[] payload) throws BrokerClientException {
        if (released.get()) {
            throw new IllegalStateException("Binding for topic " + topic.topic() + " has been released");
        }
        if (!connection.isOpen()) {
            throw new IllegalStateException("Connection for topic " + topic.topic() + " is closed");
        }
        connection.client().send(handle, payload);
    }

    void retain() {
        references.incrementAndGet();
    }

    /**
     * Retains the binding only if it is still alive.
     *
     * @return false if the count had already reached zero
     */
    boolean tryRetain() {
        while (true) {
            int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Drops one counted reference.
     *
     * @return the remaining count
     */
    public int releaseReference() {
        int remaining = references.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("Binding for topic " + topic.topic() + " released too many times");
        }
        if (remaining == 0) {
            logger.atDebug().addArgument(topic.id()).log("Binding for topic {} freed");
        }
        return remaining;
    }

    void recordDelivery(DeliveryReport report) {
        if (report.succeeded()) {
            delivered.incrementAndGet();
        } else {
            failedDeliveries.incrementAndGet();
            logger.atWarn()
                    .addArgument(topic.id())
                    .addArgument(report.error())
                    .log("Delivery to topic {} failed: {}");
        }
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        TopicHandle h = handle;
        if (h != null) {
            connection.client().destroyTopicHandle(h);
            registry.unregister(registryId, this);
            metrics.recordBindingReleased(topic.topic());
        }
        connection.detach(this);
        releaseReference();
    }
}
