package com.p14n.kafkatopology.data;

/**
 * A wire-level topic bound to a producer and/or a consumer. Either reference
 * is the empty string when unbound.
 *
 * @param id         Topic entity identifier
 * @param topic      Topic name on the wire
 * @param producerId Identifier of the producer publishing to the topic
 * @param consumerId Identifier of the consumer reading the topic
 */
public record Topic(String id, String topic, String producerId, String consumerId) implements KafkaEntity {

    public Topic {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Topic id cannot be empty");
        }
        if (topic == null || topic.isEmpty()) {
            throw new IllegalArgumentException("Topic name cannot be empty");
        }
        producerId = producerId == null ? "" : producerId;
        consumerId = consumerId == null ? "" : consumerId;
    }

    public static Topic forProducer(String id, String topic, String producerId) {
        return new Topic(id, topic, producerId, "");
    }

    public static Topic forConsumer(String id, String topic, String consumerId) {
        return new Topic(id, topic, "", consumerId);
    }

    public boolean hasProducer() {
        return !producerId.isEmpty();
    }

    public boolean hasConsumer() {
        return !consumerId.isEmpty();
    }

    @Override
    public EntityType type() {
        return EntityType.TOPIC;
    }
}
