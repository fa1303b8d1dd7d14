package com.p14n.kafkatopology.client;

/**
 * Settings the engine applies to a {@link BrokerConfig}. The field name is
 * the cluster configuration field the value comes from and is what errors
 * report.
 */
public enum ConfigProperty {

    BOOTSTRAP_SERVERS("brokers"),
    SECURITY_PROTOCOL("security_protocol"),
    SASL_MECHANISM("sasl_mechanism"),
    SASL_USERNAME("sasl_username"),
    SASL_PASSWORD("sasl_password"),
    CLIENT_ID("client_id");

    private final String fieldName;

    ConfigProperty(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
