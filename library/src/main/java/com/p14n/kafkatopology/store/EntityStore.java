package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.KafkaEntity;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Holds the declared topology entities and notifies observers when they
 * change.
 *
 * <p>
 * Field filters use the configuration field names: {@value #FIELD_CLUSTER}
 * on producers and consumers, {@value #FIELD_PRODUCER} and
 * {@value #FIELD_CONSUMER} on topics.
 * </p>
 */
public interface EntityStore extends AutoCloseable {

    String FIELD_ID = "id";
    String FIELD_CLUSTER = "cluster";
    String FIELD_PRODUCER = "producer";
    String FIELD_CONSUMER = "consumer";
    String FIELD_TOPIC = "topic";

    /**
     * Loads every entity from the backing source. Observers see a
     * {@code created} call per entity followed by one {@code loaded} call per
     * entity type.
     *
     * @throws IOException if the backing source cannot be read
     */
    void load() throws IOException;

    /**
     * Re-reads the backing source and applies the differences, notifying
     * observers of each created, updated and deleted entity.
     *
     * @throws IOException if the backing source cannot be read; the current
     *                     state is left untouched
     */
    void reload() throws IOException;

    /**
     * Retrieves every entity of the given type.
     *
     * @param type the entity class
     * @param <T>  the entity type
     * @return the entities, in no particular order
     * @throws EntityStoreException if the store cannot be queried
     */
    <T extends KafkaEntity> List<T> retrieveAll(Class<T> type);

    /**
     * Retrieves every entity of the given type whose field equals the value.
     *
     * @param type  the entity class
     * @param field the configuration field name to filter on
     * @param value the value the field must equal
     * @param <T>   the entity type
     * @return the matching entities, in no particular order
     * @throws EntityStoreException if the store cannot be queried or the field
     *                              is unknown for the type
     */
    <T extends KafkaEntity> List<T> retrieveByField(Class<T> type, String field, String value);

    /**
     * Retrieves a single entity by id.
     *
     * @param type the entity class
     * @param id   the entity id
     * @param <T>  the entity type
     * @return the entity if present
     */
    <T extends KafkaEntity> Optional<T> retrieve(Class<T> type, String id);

    /**
     * Registers an observer for changes to entities of the given type.
     *
     * @param type     the entity class
     * @param observer the observer
     * @param <T>      the entity type
     */
    <T extends KafkaEntity> void addObserver(Class<T> type, EntityObserver<? super T> observer);

    /**
     * Removes a previously registered observer.
     *
     * @param type     the entity class
     * @param observer the observer
     * @param <T>      the entity type
     * @return true if the observer was registered
     */
    <T extends KafkaEntity> boolean removeObserver(Class<T> type, EntityObserver<? super T> observer);

    @Override
    void close();
}
