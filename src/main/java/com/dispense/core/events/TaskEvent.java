package com.dispense.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A task lifecycle event published by the supervisor.
 *
 * @param eventType one of the {@code TYPE_*} constants
 * @param taskId    the task this event belongs to
 * @param payload   extra key-value data (state, exit code)
 * @param timestamp when the event occurred
 */
public record TaskEvent(
        String eventType,
        String taskId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public static final String TYPE_STARTED = "task.started";
    public static final String TYPE_STOPPED = "task.stopped";
    /** Published once the task's log sink is closed and nothing more will be written to it. */
    public static final String TYPE_FINALIZED = "task.finalized";

    public static TaskEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new TaskEvent(eventType, taskId, payload, Instant.now());
    }
}
