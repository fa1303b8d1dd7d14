package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.BrokerClientException;
import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.client.DeliveryCallback;
import com.p14n.kafkatopology.client.ProducerHandle;
import com.p14n.kafkatopology.data.Cluster;
import com.p14n.kafkatopology.telemetry.ResolutionMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens producer connections to clusters on demand.
 */
public class ClusterConnectionFactory {

    private static final Logger logger = LoggerFactory.getLogger(ClusterConnectionFactory.class);

    private final BrokerClient client;
    private final ConnectionConfigBuilder configBuilder;
    private final DeliveryCallback deliveryCallback;
    private final ResolutionMetrics metrics;

    /**
     * @param client           the broker client to open connections with
     * @param configBuilder    builds the configuration for each cluster
     * @param deliveryCallback receives delivery reports of every connection
     *                         opened by this factory
     * @param metrics          resolution metrics
     */
    public ClusterConnectionFactory(BrokerClient client, ConnectionConfigBuilder configBuilder,
            DeliveryCallback deliveryCallback, ResolutionMetrics metrics) {
        this.client = client;
        this.configBuilder = configBuilder;
        this.deliveryCallback = deliveryCallback;
        this.metrics = metrics;
    }

    /**
     * Opens a producer connection to the cluster. The caller owns the result
     * and must close it exactly once.
     *
     * @param cluster    the cluster to connect to
     * @param producerId the producer the connection is opened for
     * @return the open connection
     * @throws ConfigBuildException if the cluster's settings are rejected
     * @throws OpenException        if the library cannot open the connection
     */
    public ClusterConnection open(Cluster cluster, String producerId) throws ConfigBuildException, OpenException {
        BrokerConfig config = configBuilder.build(cluster);
        config.onDelivery(deliveryCallback);

        ProducerHandle handle;
        try {
            handle = client.open(config);
        } catch (BrokerClientException e) {
            config.release();
            throw new OpenException(e.getMessage(), e);
        }

        metrics.recordConnectionOpened(cluster.id());
        logger.atDebug()
                .addArgument(producerId)
                .addArgument(cluster.id())
                .log("Opened connection for producer {} on cluster {}");
        return new ClusterConnection(client, handle, cluster.id(), producerId);
    }
}
