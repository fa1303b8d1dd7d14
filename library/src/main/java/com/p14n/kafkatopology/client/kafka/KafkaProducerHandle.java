package com.p14n.kafkatopology.client.kafka;

import com.p14n.kafkatopology.client.DeliveryCallback;
import com.p14n.kafkatopology.client.ProducerHandle;

import org.apache.kafka.clients.producer.Producer;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A Kafka producer plus the delivery callback and flush thread that belong
 * to it.
 */
class KafkaProducerHandle implements ProducerHandle {

    private final Producer<byte[], byte[]> producer;
    private final DeliveryCallback deliveryCallback;
    private final ExecutorService flushExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    KafkaProducerHandle(Producer<byte[], byte[]> producer, DeliveryCallback deliveryCallback,
            ExecutorService flushExecutor) {
        this.producer = producer;
        this.deliveryCallback = deliveryCallback;
        this.flushExecutor = flushExecutor;
    }

    Producer<byte[], byte[]> producer() {
        return producer;
    }

    DeliveryCallback deliveryCallback() {
        return deliveryCallback;
    }

    ExecutorService flushExecutor() {
        return flushExecutor;
    }

    boolean isClosed() {
        return closed.get();
    }

    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }
}
