package com.dispense.core.error;

/**
 * Error taxonomy shared by the daemon, its HTTP surface and the controller.
 */
public enum ErrorCode {
    TASK_NOT_FOUND,
    TASK_ACTIVE,
    SANDBOX_NOT_FOUND,
    DAEMON_UNAVAILABLE,
    TUNNEL_FAILED,
    PROVIDER_UNAVAILABLE,
    PROVIDER_AUTH_FAILED,
    COMMAND_FAILED,
    INVALID_REQUEST;

    public boolean isNotFound() {
        return this == TASK_NOT_FOUND || this == SANDBOX_NOT_FOUND;
    }
}
