package com.kotsin.challenge.broker;

/**
 * Generic wrapper for any error that occurs while communicating with the venue.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
