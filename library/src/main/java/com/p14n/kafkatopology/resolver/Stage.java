package com.p14n.kafkatopology.resolver;

/**
 * Where in the topology walk an outcome was recorded.
 */
public enum Stage {
    CLUSTER,
    PRODUCER,
    CONSUMER,
    PRODUCER_TOPIC,
    CONSUMER_TOPIC
}
