package com.p14n.kafkatopology.client.kafka;

import com.p14n.kafkatopology.client.TopicHandle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka has no per-topic client object; the handle pairs the topic name
 * with its producer and opaque value.
 */
class KafkaTopicHandle implements TopicHandle {

    private final KafkaProducerHandle producer;
    private final String topicName;
    private final long opaque;
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    KafkaTopicHandle(KafkaProducerHandle producer, String topicName, long opaque) {
        this.producer = producer;
        this.topicName = topicName;
        this.opaque = opaque;
    }

    KafkaProducerHandle producer() {
        return producer;
    }

    @Override
    public String topicName() {
        return topicName;
    }

    @Override
    public long opaque() {
        return opaque;
    }

    boolean isDestroyed() {
        return destroyed.get();
    }

    void markDestroyed() {
        destroyed.set(true);
    }
}
