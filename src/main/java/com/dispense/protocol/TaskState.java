package com.dispense.protocol;

/**
 * Lifecycle state of a supervised task.
 * <p>
 * Transitions only move forward: {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 * A task that never manages to start may go straight from {@code PENDING} to {@code FAILED}.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TaskState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /** Human-readable status line reported alongside the state. */
    public String describe() {
        return switch (this) {
            case RUNNING -> "Task is currently running";
            case COMPLETED -> "Task completed successfully";
            case FAILED -> "Task failed";
            case PENDING -> "Task status unknown";
        };
    }
}
