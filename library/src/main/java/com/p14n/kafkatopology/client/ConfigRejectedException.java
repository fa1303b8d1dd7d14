package com.p14n.kafkatopology.client;

/**
 * Raised by {@link BrokerConfig#set(ConfigProperty, String)} when the client
 * library refuses a value. The message is the library's reason.
 */
public class ConfigRejectedException extends Exception {

    private final ConfigProperty property;

    public ConfigRejectedException(ConfigProperty property, String reason) {
        super(reason);
        this.property = property;
    }

    public ConfigProperty property() {
        return property;
    }
}
