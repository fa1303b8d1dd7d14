package com.p14n.kafkatopology;

/**
 * Base of the recoverable failures raised while materialising a topology.
 * The message is the cause as reported by the client library.
 */
public abstract class TopologyException extends Exception {

    protected TopologyException(String message) {
        super(message);
    }

    protected TopologyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the category this failure is recorded under
     */
    public abstract FailureKind failureKind();
}
