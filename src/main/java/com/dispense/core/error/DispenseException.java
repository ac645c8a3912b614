package com.dispense.core.error;

/**
 * Thrown when a dispense operation fails in a way callers are expected to branch on.
 * The {@link ErrorCode} tells "does not exist" apart from transport and provider failures.
 */
public class DispenseException extends RuntimeException {

    private final ErrorCode code;

    public DispenseException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DispenseException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public boolean isNotFound() {
        return code.isNotFound();
    }

    public static DispenseException taskNotFound(String taskId) {
        return new DispenseException(ErrorCode.TASK_NOT_FOUND, "Task not found: " + taskId);
    }

    public static DispenseException sandboxNotFound(String nameOrId) {
        return new DispenseException(ErrorCode.SANDBOX_NOT_FOUND, "Sandbox not found: " + nameOrId);
    }
}
