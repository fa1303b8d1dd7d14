package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.TopologyException;

public class BindException extends TopologyException {

    public BindException(String cause, Throwable source) {
        super(cause, source);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.BIND;
    }
}
