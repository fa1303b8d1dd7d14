package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.TopologyException;

public class ProbeException extends TopologyException {

    public ProbeException(String cause) {
        super(cause);
    }

    public ProbeException(String cause, Throwable source) {
        super(cause, source);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PROBE;
    }
}
