package com.p14n.kafkatopology.lifecycle;

import com.p14n.kafkatopology.data.Producer;

import java.util.Optional;

/**
 * A change to the declared producers.
 *
 * @param event    What happened
 * @param producer The producer concerned, null for {@link ProducerLifecycleEvent#LOADED_BATCH}
 */
public record ProducerLifecycleNotification(ProducerLifecycleEvent event, Producer producer) {

    public ProducerLifecycleNotification {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (producer == null && event != ProducerLifecycleEvent.LOADED_BATCH) {
            throw new IllegalArgumentException("Producer is required for " + event);
        }
    }

    public static ProducerLifecycleNotification loadedBatch() {
        return new ProducerLifecycleNotification(ProducerLifecycleEvent.LOADED_BATCH, null);
    }

    public Optional<Producer> optionalProducer() {
        return Optional.ofNullable(producer);
    }
}
