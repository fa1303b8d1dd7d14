package com.p14n.kafkatopology.connection;

/**
 * Something created under a {@link ClusterConnection} that has to be
 * released before the connection closes.
 */
public interface ConnectionResource {

    /**
     * Releases the resource. Must be idempotent.
     */
    void release();
}
