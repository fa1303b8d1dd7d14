package com.p14n.kafkatopology.client;

/**
 * An open producer-mode connection owned by a {@link BrokerClient}.
 */
public interface ProducerHandle {
}
