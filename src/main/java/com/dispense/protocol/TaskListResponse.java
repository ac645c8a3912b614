package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TaskListResponse(@JsonProperty("tasks") List<TaskInfo> tasks) {}
