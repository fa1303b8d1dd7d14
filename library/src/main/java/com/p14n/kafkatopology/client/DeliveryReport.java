package com.p14n.kafkatopology.client;

/**
 * Outcome of delivering a single message.
 *
 * @param topic     Topic the message was sent to
 * @param partition Partition it landed in, -1 when unknown
 * @param offset    Offset assigned by the broker, -1 when unknown
 * @param error     Failure description, null on success
 */
public record DeliveryReport(String topic, int partition, long offset, String error) {

    public static DeliveryReport delivered(String topic, int partition, long offset) {
        return new DeliveryReport(topic, partition, offset, null);
    }

    public static DeliveryReport failed(String topic, String error) {
        return new DeliveryReport(topic, -1, -1L, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
