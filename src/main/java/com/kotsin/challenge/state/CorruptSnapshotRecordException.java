package com.kotsin.challenge.state;

/**
 * A single persisted record could not be decoded.
 */
public class CorruptSnapshotRecordException extends RuntimeException {

    private final String key;

    public CorruptSnapshotRecordException(String key, Throwable cause) {
        super("Corrupt snapshot record " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
