package com.p14n.kafkatopology.data;

/**
 * A consumer role bound to exactly one cluster.
 *
 * @param id        Consumer identifier
 * @param clusterId Identifier of the cluster this consumer reads from
 */
public record Consumer(String id, String clusterId) implements KafkaEntity {

    public Consumer {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Consumer id cannot be empty");
        }
        clusterId = clusterId == null ? "" : clusterId;
    }

    @Override
    public EntityType type() {
        return EntityType.CONSUMER;
    }
}
