package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time snapshot of a task, as answered by the status query.
 * Timestamps are epoch milliseconds; {@code finishedAt} and {@code exitCode} are only set
 * once the task is terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatus(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("state") TaskState state,
        @JsonProperty("message") String message,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("working_directory") String workingDirectory,
        @JsonProperty("started_at") long startedAt,
        @JsonProperty("finished_at") Long finishedAt,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("error") String error
) {

    static final String IDLE_MESSAGE = "No tasks found - daemon is ready";

    /** Answer for the latest-task alias when the daemon has not run anything yet. */
    public static TaskStatus idle() {
        return new TaskStatus("", TaskState.PENDING, IDLE_MESSAGE, null, null, 0L, null, null, null);
    }

    public boolean isIdle() {
        return taskId == null || taskId.isEmpty();
    }
}
