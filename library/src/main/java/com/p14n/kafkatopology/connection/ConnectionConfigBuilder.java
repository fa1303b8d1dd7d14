package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.client.BrokerClient;
import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.client.ConfigProperty;
import com.p14n.kafkatopology.client.ConfigRejectedException;
import com.p14n.kafkatopology.data.Cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link Cluster} into a validated client configuration.
 *
 * <p>
 * Settings are applied in a fixed order: brokers, security protocol, SASL
 * mechanism, SASL username, SASL password, client id. The first setting the
 * client library rejects releases the partially built configuration and
 * fails the build, so a caller never holds a half-applied configuration.
 * </p>
 */
public class ConnectionConfigBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionConfigBuilder.class);

    private final BrokerClient client;

    public ConnectionConfigBuilder(BrokerClient client) {
        this.client = client;
    }

    /**
     * Builds the configuration for a cluster.
     *
     * @param cluster the cluster to connect to
     * @return a complete configuration owned by the caller
     * @throws ConfigBuildException naming the first field the library rejected
     */
    public BrokerConfig build(Cluster cluster) throws ConfigBuildException {
        BrokerConfig config = client.newConfig();
        try {
            config.set(ConfigProperty.BOOTSTRAP_SERVERS, cluster.brokers());
            config.set(ConfigProperty.SECURITY_PROTOCOL, cluster.securityProtocol());
            config.set(ConfigProperty.SASL_MECHANISM, cluster.saslMechanism());
            config.set(ConfigProperty.SASL_USERNAME, cluster.saslUsername());
            config.set(ConfigProperty.SASL_PASSWORD, cluster.saslPassword());
            config.set(ConfigProperty.CLIENT_ID, cluster.clientId());
        } catch (ConfigRejectedException e) {
            config.release();
            throw new ConfigBuildException(e.property().fieldName(), e.getMessage());
        }
        logger.atDebug()
                .addArgument(cluster.id())
                .addArgument(cluster.brokers())
                .log("Built client configuration for cluster {} with brokers {}");
        return config;
    }
}
