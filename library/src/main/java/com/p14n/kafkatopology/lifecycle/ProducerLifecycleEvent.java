package com.p14n.kafkatopology.lifecycle;

public enum ProducerLifecycleEvent {
    CREATED,
    UPDATED,
    DELETED,
    /** A load or reload of all producers finished. */
    LOADED_BATCH
}
