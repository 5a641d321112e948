package com.kotsin.challenge.broker;

/**
 * The venue refused the request (invalid price, insufficient margin, unknown ticket). Never retried.
 */
public class OrderRejectedException extends BrokerException {

    public OrderRejectedException(String message) {
        super(message);
    }
}
