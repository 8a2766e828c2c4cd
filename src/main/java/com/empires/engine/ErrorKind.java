package com.empires.engine;

/**
 * Typed reasons an action can be rejected.
 */
public enum ErrorKind {
    NOT_PLAYER_TURN(false),
    /** Another action for the same game is being processed; retry later. */
    TURN_BUSY(true),
    NO_ACTIONS_LEFT(false),
    OUT_OF_RANGE(false),
    INVALID_TARGET(false),
    SCHEMA_MISMATCH(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
