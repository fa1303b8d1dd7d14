package com.p14n.kafkatopology.client;

/**
 * A topic materialised under a {@link ProducerHandle}.
 */
public interface TopicHandle {

    String topicName();

    /**
     * The value handed back to delivery callbacks for messages sent through
     * this handle.
     *
     * @return the opaque value
     */
    long opaque();
}
