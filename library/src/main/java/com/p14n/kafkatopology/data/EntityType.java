package com.p14n.kafkatopology.data;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of entity that make up a topology. The config name is the value of
 * the {@code type} key in {@code kafka.conf}.
 */
public enum EntityType {

    CLUSTER("cluster", Cluster.class),
    PRODUCER("producer", Producer.class),
    CONSUMER("consumer", Consumer.class),
    TOPIC("topic", Topic.class);

    private final String configName;
    private final Class<? extends KafkaEntity> entityClass;

    EntityType(String configName, Class<? extends KafkaEntity> entityClass) {
        this.configName = configName;
        this.entityClass = entityClass;
    }

    public String configName() {
        return configName;
    }

    public Class<? extends KafkaEntity> entityClass() {
        return entityClass;
    }

    public static Optional<EntityType> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.configName.equalsIgnoreCase(name))
                .findFirst();
    }

    public static EntityType of(Class<? extends KafkaEntity> entityClass) {
        return Arrays.stream(values())
                .filter(t -> t.entityClass.equals(entityClass))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Not a topology entity: " + entityClass.getName()));
    }
}
