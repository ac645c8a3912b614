package com.dispense.follow;

/**
 * How a follow session ended.
 */
public enum FollowOutcome {
    COMPLETED("Task completed"),
    FAILED("Task failed"),
    CONNECTION_LOST("Lost connection to the daemon"),
    INTERRUPTED("Stopped following");

    private final String message;

    FollowOutcome(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
