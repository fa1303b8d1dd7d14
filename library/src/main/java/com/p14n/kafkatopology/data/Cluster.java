package com.p14n.kafkatopology.data;

import java.util.Arrays;
import java.util.List;

/**
 * A named group of broker endpoints plus connection and security settings.
 *
 * <p>
 * The security protocol and SASL mechanism are held as the raw configured
 * strings; they are validated when a client configuration is built from the
 * cluster, not when the cluster is declared.
 * </p>
 *
 * @param id               Cluster identifier
 * @param brokers          CSV list of bootstrap brokers, {@code host} or {@code host:port}
 * @param securityProtocol Security protocol used to talk to the brokers
 * @param saslMechanism    SASL mechanism used to authenticate
 * @param saslUsername     SASL username, passed through opaquely
 * @param saslPassword     SASL password, passed through opaquely
 * @param clientId         Client identifier presented to the brokers
 * @param port             Broker port
 * @param ssl              Whether the brokers must be reached over SSL
 */
public record Cluster(String id,
        String brokers,
        String securityProtocol,
        String saslMechanism,
        String saslUsername,
        String saslPassword,
        String clientId,
        int port,
        boolean ssl) implements KafkaEntity {

    public static final String DEFAULT_BROKERS = "localhost";
    public static final String DEFAULT_SECURITY_PROTOCOL = "plaintext";
    public static final String DEFAULT_SASL_MECHANISM = "PLAIN";
    public static final String DEFAULT_CLIENT_ID = "asterisk";
    public static final int DEFAULT_PORT = 1883;

    public Cluster {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Cluster id cannot be empty");
        }
        if (port < 0) {
            throw new IllegalArgumentException("Cluster port cannot be negative");
        }
        saslUsername = saslUsername == null ? "" : saslUsername;
        saslPassword = saslPassword == null ? "" : saslPassword;
    }

    /**
     * Creates a cluster with the default settings for everything but the
     * brokers.
     *
     * @param id      Cluster identifier
     * @param brokers CSV list of bootstrap brokers
     * @return the cluster
     */
    public static Cluster withBrokers(String id, String brokers) {
        return new Cluster(id, brokers, DEFAULT_SECURITY_PROTOCOL, DEFAULT_SASL_MECHANISM, "", "",
                DEFAULT_CLIENT_ID, DEFAULT_PORT, false);
    }

    /**
     * Splits the broker CSV into an ordered list, dropping blank entries.
     *
     * @return the brokers in declaration order
     */
    public List<String> brokerList() {
        if (brokers == null) {
            return List.of();
        }
        return Arrays.stream(brokers.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public EntityType type() {
        return EntityType.CLUSTER;
    }

    @Override
    public String toString() {
        return "Cluster[id=" + id + ", brokers=" + brokers + ", securityProtocol=" + securityProtocol
                + ", saslMechanism=" + saslMechanism + ", clientId=" + clientId + "]";
    }
}
