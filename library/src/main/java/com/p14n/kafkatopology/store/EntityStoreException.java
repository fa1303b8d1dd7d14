package com.p14n.kafkatopology.store;

/**
 * Raised when an {@link EntityStore} cannot answer a query.
 */
public class EntityStoreException extends RuntimeException {

    public EntityStoreException(String message) {
        super(message);
    }

    public EntityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
