package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.client.ConfigProperty;
import com.p14n.kafkatopology.client.RecordingBrokerClient;
import com.p14n.kafkatopology.client.RecordingBrokerClient.RecordingConfig;
import com.p14n.kafkatopology.data.Cluster;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionConfigBuilderTest {

    private RecordingBrokerClient client;
    private ConnectionConfigBuilder builder;

    @BeforeEach
    void setUp() {
        client = new RecordingBrokerClient();
        builder = new ConnectionConfigBuilder(client);
    }

    @Test
    void appliesEverySettingInOrder() throws Exception {
        Cluster cluster = new Cluster("main", "b1:9092,b2", "sasl_ssl", "SCRAM-SHA-256", "user", "secret",
                "app", Cluster.DEFAULT_PORT, false);

        BrokerConfig config = builder.build(cluster);

        RecordingConfig recorded = (RecordingConfig) config;
        assertEquals(List.of(ConfigProperty.BOOTSTRAP_SERVERS,
                ConfigProperty.SECURITY_PROTOCOL,
                ConfigProperty.SASL_MECHANISM,
                ConfigProperty.SASL_USERNAME,
                ConfigProperty.SASL_PASSWORD,
                ConfigProperty.CLIENT_ID), recorded.order);
        assertEquals("b1:9092,b2", recorded.settings.get(ConfigProperty.BOOTSTRAP_SERVERS));
        assertEquals("app", recorded.settings.get(ConfigProperty.CLIENT_ID));
        assertFalse(recorded.released);
    }

    @Test
    void rejectedSecurityProtocolReleasesConfigAndNamesField() {
        Cluster cluster = new Cluster("main", "b1:9092", "bogus", "PLAIN", "", "", "app",
                Cluster.DEFAULT_PORT, false);

        ConfigBuildException e = assertThrows(ConfigBuildException.class, () -> builder.build(cluster));

        assertEquals("security_protocol", e.field());
        assertEquals(FailureKind.CONFIG, e.failureKind());
        assertTrue(e.getMessage().contains("bogus"));
        RecordingConfig recorded = client.configs.get(0);
        assertTrue(recorded.released);
        assertEquals(List.of(ConfigProperty.BOOTSTRAP_SERVERS, ConfigProperty.SECURITY_PROTOCOL), recorded.order);
    }

    @Test
    void rejectedMechanismStopsBeforeCredentials() {
        Cluster cluster = new Cluster("main", "b1:9092", "sasl_plaintext", "KERBEROS5", "u", "p", "app",
                Cluster.DEFAULT_PORT, false);

        ConfigBuildException e = assertThrows(ConfigBuildException.class, () -> builder.build(cluster));

        assertEquals("sasl_mechanism", e.field());
        assertFalse(client.configs.get(0).order.contains(ConfigProperty.SASL_USERNAME));
    }
}
