package com.p14n.kafkatopology.client;

/**
 * Receives the outcome of each produced message. May be invoked on a thread
 * owned by the client library.
 */
@FunctionalInterface
public interface DeliveryCallback {

    /**
     * @param opaque the value the topic handle was created with
     * @param report the delivery outcome
     */
    void onDelivery(long opaque, DeliveryReport report);
}
