package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code GET /api/v1/health}.
 *
 * @param status        worst component status: UP, DEGRADED or DOWN
 * @param activeTasks   tasks pending or running
 * @param totalTasks    tasks held by the registry
 * @param activeStreams open SSE streams
 * @param components    per-component results, keyed by component name
 */
public record DaemonHealth(
        @JsonProperty("status") String status,
        @JsonProperty("active_tasks") int activeTasks,
        @JsonProperty("total_tasks") int totalTasks,
        @JsonProperty("active_streams") int activeStreams,
        @JsonProperty("components") Map<String, Component> components
) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Component(
            @JsonProperty("status") String status,
            @JsonProperty("detail") String detail,
            @JsonProperty("metadata") Map<String, String> metadata
    ) {}

    public boolean isDown() {
        return "DOWN".equals(status);
    }
}
