package com.kotsin.challenge.broker;

public enum OrderStatus {
    OPEN,
    FILLED,
    CANCELLED,
    REJECTED
}
