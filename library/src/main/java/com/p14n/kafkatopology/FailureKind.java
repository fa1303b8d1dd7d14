package com.p14n.kafkatopology;

/**
 * Categories of failure recorded while resolving a topology. None of them is
 * fatal to a resolution pass.
 */
public enum FailureKind {

    /** A cluster setting was rejected by the client library. */
    CONFIG,

    /** The client library could not open a connection. */
    OPEN,

    /** A topic handle could not be created. */
    BIND,

    /** The probe send or flush failed. */
    PROBE,

    /** An entity refers to a cluster, producer or consumer that does not exist. */
    UNRESOLVED_REFERENCE,

    /** The entity store could not answer a query. */
    STORE
}
