package com.dispense.follow;

import com.dispense.protocol.TaskStatus;

/**
 * Queries the current status of the followed task. Any {@link RuntimeException} is taken
 * to mean the daemon can no longer be reached.
 */
@FunctionalInterface
public interface TaskStatusProbe {

    TaskStatus status();
}
