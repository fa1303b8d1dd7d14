package com.p14n.kafkatopology.data;

/**
 * Common contract of every entity declared in the topology configuration.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: Unique identifier, the section name in {@code kafka.conf}</li>
 * <li>{@code type}: Which kind of topology entity this is</li>
 * </ul>
 */
public interface KafkaEntity {

    /**
     * Returns the unique identifier of the entity.
     *
     * @return the entity id
     */
    String id();

    /**
     * Returns the kind of entity.
     *
     * @return the entity type
     */
    EntityType type();
}
