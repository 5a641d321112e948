package com.kotsin.challenge.service;

import com.kotsin.challenge.model.Position;

public class FillResult {
    private final boolean success;
    private final FillError error;
    private final String message;
    private final Position position;

    private FillResult(boolean success, FillError error, String message, Position position) {
        this.success = success;
        this.error = error;
        this.message = message;
        this.position = position;
    }

    public static FillResult filled(Position position) {
        return new FillResult(true, null, "filled", position);
    }

    /** Limit order accepted by the venue; no position yet. */
    public static FillResult resting(String orderId) {
        return new FillResult(true, null, "resting " + orderId, null);
    }

    public static FillResult failed(FillError error, String message) {
        return new FillResult(false, error, message, null);
    }

    public boolean isSuccess() { return success; }
    public FillError getError() { return error; }
    public String getMessage() { return message; }
    public Position getPosition() { return position; }

    @Override
    public String toString() {
        return success ? "FillResult[" + message + "]" : "FillResult[" + error + ": " + message + "]";
    }
}
