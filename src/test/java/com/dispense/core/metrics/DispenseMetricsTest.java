package com.dispense.core.metrics;

import com.dispense.protocol.TaskState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DispenseMetricsTest {

    private SimpleMeterRegistry registry;
    private DispenseMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DispenseMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskStarted increments the started counter")
    void recordTaskStarted() {
        metrics.recordTaskStarted();
        metrics.recordTaskStarted();

        assertEquals(2.0, registry.find("dispense.tasks.started").counter().count());
    }

    @Test
    @DisplayName("recordTaskResult counts and times by state tag")
    void recordTaskResult() {
        metrics.recordTaskResult(TaskState.COMPLETED, Duration.ofMillis(300));
        metrics.recordTaskResult(TaskState.COMPLETED, Duration.ofMillis(100));
        metrics.recordTaskResult(TaskState.FAILED, Duration.ofMillis(50));

        var completed = registry.find("dispense.tasks.total").tag("state", "completed").counter();
        var failed = registry.find("dispense.tasks.total").tag("state", "failed").counter();
        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, failed.count());

        var timer = registry.find("dispense.tasks.duration").tag("state", "completed").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("stream gauge follows opened and closed streams")
    void streamGauge() {
        metrics.streamOpened();
        metrics.streamOpened();
        metrics.streamClosed();

        assertEquals(1, metrics.activeStreams());
        assertEquals(1.0, registry.find("dispense.streams.active").gauge().value());
    }

    @Test
    @DisplayName("recordConnection tags kind and outcome")
    void recordConnection() {
        metrics.recordConnection("remote", true);
        metrics.recordConnection("remote", false);
        metrics.recordConnection("local", true);

        assertEquals(1.0, registry.find("dispense.connections")
                .tag("kind", "remote").tag("success", "false").counter().count());
        assertEquals(1.0, registry.find("dispense.connections")
                .tag("kind", "local").tag("success", "true").counter().count());
    }

    @Test
    @DisplayName("recordTaskStopped increments the stopped counter")
    void recordTaskStopped() {
        metrics.recordTaskStopped();
        assertEquals(1.0, registry.find("dispense.tasks.stopped").counter().count());
    }
}
