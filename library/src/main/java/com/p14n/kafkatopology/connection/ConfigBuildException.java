package com.p14n.kafkatopology.connection;

import com.p14n.kafkatopology.FailureKind;
import com.p14n.kafkatopology.TopologyException;

/**
 * A cluster setting was rejected while building a client configuration.
 */
public class ConfigBuildException extends TopologyException {

    private final String field;

    public ConfigBuildException(String field, String cause) {
        super("Unable to set " + field + " because " + cause);
        this.field = field;
    }

    /**
     * @return the cluster configuration field whose value was rejected
     */
    public String field() {
        return field;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.CONFIG;
    }
}
