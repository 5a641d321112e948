package com.kotsin.challenge.state;

public class StatePersistenceException extends RuntimeException {

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
