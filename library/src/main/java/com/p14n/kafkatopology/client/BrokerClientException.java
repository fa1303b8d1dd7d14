package com.p14n.kafkatopology.client;

/**
 * Failure reported by the broker client library. The message is the
 * library's own description.
 */
public class BrokerClientException extends Exception {

    public BrokerClientException(String message) {
        super(message);
    }

    public BrokerClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
