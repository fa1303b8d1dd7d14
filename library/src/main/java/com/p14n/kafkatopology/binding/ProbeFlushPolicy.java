package com.p14n.kafkatopology.binding;

import com.p14n.kafkatopology.client.FlushResult;

/**
 * Decides whether the flush that follows a probe send fails the probe.
 */
public enum ProbeFlushPolicy {

    /** A flush that timed out or failed fails the probe. */
    FAIL_ON_FLUSH_ERROR {
        @Override
        public boolean isFailure(FlushResult result) {
            return !result.isOk();
        }
    },

    /**
     * A flush that completed fails the probe and any other result passes.
     * Reproduces deployments that relied on the inverted check.
     */
    FAIL_ON_FLUSH_SUCCESS {
        @Override
        public boolean isFailure(FlushResult result) {
            return result.isOk();
        }
    };

    public abstract boolean isFailure(FlushResult result);
}
