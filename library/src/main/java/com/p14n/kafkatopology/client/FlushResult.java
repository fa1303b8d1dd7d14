package com.p14n.kafkatopology.client;

/**
 * Outcome of {@link BrokerClient#flush(ProducerHandle, java.time.Duration)}.
 *
 * @param status Result code
 * @param cause  Library description of a non-OK result, empty when OK
 */
public record FlushResult(Status status, String cause) {

    public enum Status {
        OK,
        TIMED_OUT,
        FAILED
    }

    private static final FlushResult OK_RESULT = new FlushResult(Status.OK, "");

    public static FlushResult ok() {
        return OK_RESULT;
    }

    public static FlushResult timedOut(String cause) {
        return new FlushResult(Status.TIMED_OUT, cause);
    }

    public static FlushResult failed(String cause) {
        return new FlushResult(Status.FAILED, cause);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
