package com.p14n.kafkatopology.store;

import com.p14n.kafkatopology.data.EntityType;

/**
 * Receives change notifications from an {@link EntityStore}. Notifications
 * are delivered synchronously on the thread that changed the store.
 *
 * @param <T> The entity type observed
 */
public interface EntityObserver<T> {

    default void created(T entity) {
    }

    default void updated(T entity) {
    }

    default void deleted(T entity) {
    }

    /**
     * Called once per entity type after a load or reload has been applied.
     *
     * @param type the entity type that finished loading
     */
    default void loaded(EntityType type) {
    }
}
