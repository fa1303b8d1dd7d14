package com.p14n.kafkatopology.client;

import java.time.Duration;

/**
 * The broker protocol client the topology engine drives. Implementations
 * must allow {@link DeliveryCallback}s to run on their own threads
 * concurrently with the calls below.
 */
public interface BrokerClient {

    /**
     * Returns the version string of the underlying client library.
     *
     * @return the version
     */
    String version();

    /**
     * Creates a fresh, empty configuration object. The caller owns it until
     * it is handed to {@link #open(BrokerConfig)} or released.
     *
     * @return the configuration
     */
    BrokerConfig newConfig();

    /**
     * Opens a producer-mode connection. On success the configuration is
     * consumed by the connection; on failure the caller still owns it.
     *
     * @param config the configuration to open with
     * @return the connection handle
     * @throws BrokerClientException if the library refuses to open
     */
    ProducerHandle open(BrokerConfig config) throws BrokerClientException;

    /**
     * Closes a connection previously returned by {@link #open(BrokerConfig)}.
     *
     * @param handle the connection
     */
    void close(ProducerHandle handle);

    /**
     * Creates a handle for a topic under an open connection. The opaque value
     * is returned to the connection's delivery callback for every message
     * sent through the handle.
     *
     * @param handle    the owning connection
     * @param topicName the wire-level topic name
     * @param opaque    value handed back to delivery callbacks
     * @return the topic handle
     * @throws BrokerClientException if the handle cannot be created
     */
    TopicHandle createTopicHandle(ProducerHandle handle, String topicName, long opaque) throws BrokerClientException;

    /**
     * Queues a payload for the topic.
     *
     * @param topic   the topic handle
     * @param payload the bytes to send, copied by the library
     * @throws BrokerClientException if the payload cannot be queued
     */
    void send(TopicHandle topic, byte[] payload) throws BrokerClientException;

    /**
     * Waits for queued messages of the connection to be delivered, for at
     * most the given time.
     *
     * @param handle  the connection
     * @param timeout the upper bound on waiting
     * @return the outcome reported by the library
     */
    FlushResult flush(ProducerHandle handle, Duration timeout);

    /**
     * Destroys a topic handle. The handle's opaque value is not used by the
     * library after this returns.
     *
     * @param topic the topic handle
     */
    void destroyTopicHandle(TopicHandle topic);
}
