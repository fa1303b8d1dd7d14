package com.p14n.kafkatopology.data;

/**
 * A producer role bound to exactly one cluster.
 *
 * @param id        Producer identifier
 * @param clusterId Identifier of the cluster this producer publishes to
 */
public record Producer(String id, String clusterId) implements KafkaEntity {

    public Producer {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Producer id cannot be empty");
        }
        clusterId = clusterId == null ? "" : clusterId;
    }

    @Override
    public EntityType type() {
        return EntityType.PRODUCER;
    }
}
