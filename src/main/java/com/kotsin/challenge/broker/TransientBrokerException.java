package com.kotsin.challenge.broker;

/**
 * Network failure or timeout. The only venue error that is retried.
 */
public class TransientBrokerException extends BrokerException {

    public TransientBrokerException(String message) {
        super(message);
    }

    public TransientBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
