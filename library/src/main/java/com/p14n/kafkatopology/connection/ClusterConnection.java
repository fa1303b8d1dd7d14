package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.FlushResult;
import com.p14n.kafkatopology.client.ProducerHandle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One open producer connection to a cluster, exclusively owned by whoever
 * opened it. Closing is idempotent; resources still attached when it closes
 * are released first so nothing created under the connection outlives it.
 */
public class ClusterConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ClusterConnection.class);

    private final BrokerClient client;
    private final ProducerHandle handle;
    private final String clusterId;
    private final String producerId;
    private final Set<ConnectionResource> resources = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ClusterConnection(BrokerClient client, ProducerHandle handle, String clusterId, String producerId) {
        this.client = client;
        this.handle = handle;
        this.clusterId = clusterId;
        this.producerId = producerId;
    }

    public String clusterId() {
        return clusterId;
    }

    public String producerId() {
        return producerId;
    }

    public BrokerClient client() {
        return client;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * @return the library handle
     * @throws IllegalStateException if the connection is closed
     */
    public ProducerHandle handle() {
        checkOpen();
        return handle;
    }

    public void attach(ConnectionResource resource) {
        checkOpen();
        resources.add(resource);
    }

    public void detach(ConnectionResource resource) {
        resources.remove(resource);
    }

    public int attachedResources() {
        return resources.size();
    }

    /**
     * Waits for queued messages to be delivered.
     *
     * @param timeout upper bound on the wait
     * @return the library's result
     */
    public FlushResult flush(Duration timeout) {
        checkOpen();
        return client.flush(handle, timeout);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<ConnectionResource> remaining = List.copyOf(resources);
        if (!remaining.isEmpty()) {
            logger.atWarn()
                    .addArgument(remaining.size())
                    .addArgument(producerId)
                    .addArgument(clusterId)
                    .log("Releasing {} resources still attached to producer {} on cluster {}");
            remaining.forEach(ConnectionResource::release);
        }
        resources.clear();
        client.close(handle);
        logger.atDebug()
                .addArgument(producerId)
                .addArgument(clusterId)
                .log("Closed connection of producer {} on cluster {}");
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Connection of producer " + producerId + " on cluster "
                    + clusterId + " is closed");
        }
    }
}
