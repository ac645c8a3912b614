package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of the task listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskInfo(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("state") TaskState state,
        @JsonProperty("working_directory") String workingDirectory,
        @JsonProperty("started_at") long startedAt,
        @JsonProperty("finished_at") Long finishedAt,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("error") String error
) {}
