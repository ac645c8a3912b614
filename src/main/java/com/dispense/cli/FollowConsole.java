package com.dispense.cli;

import com.dispense.follow.AgentMessageDecoder;
import com.dispense.follow.LogFollower;
import com.dispense.follow.LogRenderer;
import com.dispense.follow.LogSource;
import com.dispense.follow.ProgressIndicator;
import com.dispense.follow.RenderMode;
import com.dispense.follow.TaskStatusProbe;
import com.dispense.follow.WorkingStateClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Terminal wiring for a follow session: renderer output goes through the spinner so the
 * two never interleave on one line.
 */
final class FollowConsole implements AutoCloseable {

    private final ProgressIndicator indicator;
    private final LogRenderer renderer;

    FollowConsole(RenderMode mode, ObjectMapper objectMapper) {
        WorkingStateClassifier classifier = new WorkingStateClassifier();
        this.indicator = ProgressIndicator.forConsole(classifier);
        this.renderer = new LogRenderer(mode, indicator::println, classifier, new AgentMessageDecoder(objectMapper));
        if (mode != RenderMode.RAW) {
            indicator.start();
        }
    }

    LogFollower follower(LogSource source, TaskStatusProbe probe, ControllerProperties properties) {
        return new LogFollower(source, probe, renderer, properties.getPollInterval(), properties.getMissingFileRetry());
    }

    @Override
    public void close() {
        indicator.close();
    }
}
