package com.p14n.kafkatopology.client.kafka;

import com.p14n.kafkatopology.client.BrokerConfig;
import com.p14n.kafkatopology.client.ConfigProperty;
import com.p14n.kafkatopology.client.ConfigRejectedException;
import com.p14n.kafkatopology.client.DeliveryCallback;
import com.p14n.kafkatopology.data.SaslMechanism;
import com.p14n.kafkatopology.data.SecurityProtocol;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.utils.Utils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * {@link BrokerConfig} producing {@code KafkaProducer} properties. Each
 * setting is validated with Kafka's own parsing rules as it is applied.
 */
public class KafkaBrokerConfig implements BrokerConfig {

    public static final int DEFAULT_BROKER_PORT = 9092;

    /** Upper bound on how long a send may block waiting for metadata. */
    public static final Duration MAX_BLOCK = Duration.ofSeconds(10);

    private final Properties properties = new Properties();
    private SecurityProtocol securityProtocol = SecurityProtocol.PLAINTEXT;
    private SaslMechanism saslMechanism = SaslMechanism.PLAIN;
    private String saslUsername = "";
    private String saslPassword = "";
    private DeliveryCallback deliveryCallback;
    private volatile boolean released;

    @Override
    public void set(ConfigProperty property, String value) throws ConfigRejectedException {
        checkNotReleased();
        if (value == null) {
            throw new ConfigRejectedException(property, "Value for \"" + property.fieldName() + "\" is missing");
        }
        switch (property) {
            case BOOTSTRAP_SERVERS:
                properties.setProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers(value));
                break;
            case SECURITY_PROTOCOL:
                securityProtocol = SecurityProtocol.parse(value)
                        .orElseThrow(() -> invalid(property, value, CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
                properties.setProperty(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, securityProtocol.name());
                break;
            case SASL_MECHANISM:
                saslMechanism = SaslMechanism.parse(value)
                        .orElseThrow(() -> invalid(property, value, SaslConfigs.SASL_MECHANISM));
                properties.setProperty(SaslConfigs.SASL_MECHANISM, saslMechanism.mechanismName());
                break;
            case SASL_USERNAME:
                saslUsername = jaasSafe(property, value);
                break;
            case SASL_PASSWORD:
                saslPassword = jaasSafe(property, value);
                break;
            case CLIENT_ID:
                properties.setProperty(ProducerConfig.CLIENT_ID_CONFIG, value);
                break;
            default:
                throw new ConfigRejectedException(property, "Unsupported property " + property);
        }
    }

    @Override
    public void onDelivery(DeliveryCallback callback) {
        checkNotReleased();
        this.deliveryCallback = callback;
    }

    @Override
    public void release() {
        released = true;
        properties.clear();
        saslPassword = "";
    }

    public boolean isReleased() {
        return released;
    }

    DeliveryCallback deliveryCallback() {
        return deliveryCallback;
    }

    /**
     * Builds the producer properties from the settings applied so far.
     *
     * @return a fresh copy of the properties
     */
    public Properties toProperties() {
        checkNotReleased();
        Properties p = new Properties();
        p.putAll(properties);
        p.setProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        p.setProperty(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        p.setProperty(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(MAX_BLOCK.toMillis()));

        if (securityProtocol.usesSasl() && !saslUsername.isEmpty()) {
            saslMechanism.passwordLoginModule().ifPresent(module -> p.setProperty(SaslConfigs.SASL_JAAS_CONFIG,
                    module + " required username=\"" + saslUsername + "\" password=\"" + saslPassword + "\";"));
        }
        return p;
    }

    static String bootstrapServers(String value) throws ConfigRejectedException {
        List<String> servers = new ArrayList<>();
        for (String raw : value.split(",")) {
            String broker = raw.trim();
            if (broker.isEmpty()) {
                continue;
            }
            if (Utils.getPort(broker) == null) {
                if (broker.indexOf(':') >= 0) {
                    throw new ConfigRejectedException(ConfigProperty.BOOTSTRAP_SERVERS,
                            "Invalid broker address \"" + broker + "\"");
                }
                broker = broker + ":" + DEFAULT_BROKER_PORT;
            }
            String host = Utils.getHost(broker);
            Integer port = Utils.getPort(broker);
            if (host == null || host.isEmpty() || port == null || port < 1 || port > 65535) {
                throw new ConfigRejectedException(ConfigProperty.BOOTSTRAP_SERVERS,
                        "Invalid broker address \"" + raw.trim() + "\"");
            }
            servers.add(broker);
        }
        if (servers.isEmpty()) {
            throw new ConfigRejectedException(ConfigProperty.BOOTSTRAP_SERVERS, "No brokers configured");
        }
        return String.join(",", servers);
    }

    private static String jaasSafe(ConfigProperty property, String value) throws ConfigRejectedException {
        if (value.indexOf('"') >= 0 || value.indexOf('\\') >= 0) {
            throw new ConfigRejectedException(property,
                    "Value for \"" + property.fieldName() + "\" must not contain quotes or backslashes");
        }
        return value;
    }

    private static ConfigRejectedException invalid(ConfigProperty property, String value, String kafkaName) {
        return new ConfigRejectedException(property,
                "Invalid value \"" + value + "\" for configuration property \"" + kafkaName + "\"");
    }

    private void checkNotReleased() {
        if (released) {
            throw new IllegalStateException("Configuration has been released");
        }
    }
}
