package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateTaskResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("message") String message
) {}
