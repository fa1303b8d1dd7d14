package com.p14n.kafkatopology.client.kafka;

import com.p14n.kafkatopology.client.ConfigProperty;
import com.p14n.kafkatopology.client.ConfigRejectedException;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaBrokerConfigTest {

    @Test
    void brokersWithoutPortGetDefaultPort() throws Exception {
        assertEquals("b1:9092,b2:9093", KafkaBrokerConfig.bootstrapServers("b1, b2:9093"));
        assertEquals("localhost:9092", KafkaBrokerConfig.bootstrapServers("localhost"));
    }

    @Test
    void malformedBrokersAreRejected() {
        assertThrows(ConfigRejectedException.class, () -> KafkaBrokerConfig.bootstrapServers("b1:abc"));
        assertThrows(ConfigRejectedException.class, () -> KafkaBrokerConfig.bootstrapServers("b1:70000"));
        ConfigRejectedException e = assertThrows(ConfigRejectedException.class,
                () -> KafkaBrokerConfig.bootstrapServers(" , "));
        assertEquals(ConfigProperty.BOOTSTRAP_SERVERS, e.property());
    }

    @Test
    void unknownSecurityProtocolIsRejected() {
        KafkaBrokerConfig config = new KafkaBrokerConfig();

        ConfigRejectedException e = assertThrows(ConfigRejectedException.class,
                () -> config.set(ConfigProperty.SECURITY_PROTOCOL, "tls"));

        assertEquals("Invalid value \"tls\" for configuration property \"security.protocol\"", e.getMessage());
        assertEquals(ConfigProperty.SECURITY_PROTOCOL, e.property());
    }

    @Test
    void buildsProducerProperties() throws Exception {
        KafkaBrokerConfig config = new KafkaBrokerConfig();
        config.set(ConfigProperty.BOOTSTRAP_SERVERS, "b1");
        config.set(ConfigProperty.SECURITY_PROTOCOL, "plaintext");
        config.set(ConfigProperty.SASL_MECHANISM, "PLAIN");
        config.set(ConfigProperty.SASL_USERNAME, "");
        config.set(ConfigProperty.SASL_PASSWORD, "");
        config.set(ConfigProperty.CLIENT_ID, "asterisk");

        Properties props = config.toProperties();

        assertEquals("b1:9092", props.getProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("PLAINTEXT", props.getProperty(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
        assertEquals("asterisk", props.getProperty(ProducerConfig.CLIENT_ID_CONFIG));
        assertEquals("10000", props.getProperty(ProducerConfig.MAX_BLOCK_MS_CONFIG));
        assertNull(props.getProperty(SaslConfigs.SASL_JAAS_CONFIG));
    }

    @Test
    void saslCredentialsBecomeJaasConfig() throws Exception {
        KafkaBrokerConfig config = new KafkaBrokerConfig();
        config.set(ConfigProperty.BOOTSTRAP_SERVERS, "b1:9094");
        config.set(ConfigProperty.SECURITY_PROTOCOL, "sasl_ssl");
        config.set(ConfigProperty.SASL_MECHANISM, "scram-sha-256");
        config.set(ConfigProperty.SASL_USERNAME, "svc");
        config.set(ConfigProperty.SASL_PASSWORD, "secret");

        Properties props = config.toProperties();

        assertEquals("SCRAM-SHA-256", props.getProperty(SaslConfigs.SASL_MECHANISM));
        assertEquals("org.apache.kafka.common.security.scram.ScramLoginModule required "
                + "username=\"svc\" password=\"secret\";", props.getProperty(SaslConfigs.SASL_JAAS_CONFIG));
    }

    @Test
    void credentialsThatWouldBreakJaasAreRejected() {
        KafkaBrokerConfig config = new KafkaBrokerConfig();

        assertThrows(ConfigRejectedException.class, () -> config.set(ConfigProperty.SASL_PASSWORD, "se\"cret"));
        assertThrows(ConfigRejectedException.class, () -> config.set(ConfigProperty.SASL_USERNAME, "dom\\user"));
    }

    @Test
    void releasedConfigCannotBeUsed() {
        KafkaBrokerConfig config = new KafkaBrokerConfig();
        config.release();
        config.release();

        assertTrue(config.isReleased());
        assertThrows(IllegalStateException.class, () -> config.set(ConfigProperty.CLIENT_ID, "x"));
        assertThrows(IllegalStateException.class, config::toProperties);
    }
}
