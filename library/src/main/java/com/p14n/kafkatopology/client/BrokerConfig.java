package com.p14n.kafkatopology.client;

/**
 * Mutable client configuration, validated setting by setting.
 */
public interface BrokerConfig {

    /**
     * Applies a setting.
     *
     * @param property the setting
     * @param value    the configured value
     * @throws ConfigRejectedException if the client library rejects the value
     */
    void set(ConfigProperty property, String value) throws ConfigRejectedException;

    /**
     * Registers the callback that receives delivery reports for every
     * message produced through connections opened with this configuration.
     *
     * @param callback the callback
     */
    void onDelivery(DeliveryCallback callback);

    /**
     * Releases the configuration when it will not be handed to
     * {@link BrokerClient#open(BrokerConfig)}. Safe to call more than once.
     */
    void release();
}
