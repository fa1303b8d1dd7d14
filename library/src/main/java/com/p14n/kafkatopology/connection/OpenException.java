package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.TopologyException;

/**
 * The client library could not open a connection. Carries only the library's
 * cause; the caller knows which cluster and producer it was opening for.
 */
public class OpenException extends TopologyException {

    public OpenException(String cause, Throwable source) {
        super(cause, source);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.OPEN;
    }
}
