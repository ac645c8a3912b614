package com.dispense.core.metrics;

import com.dispense.protocol.TaskState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for task supervision, streaming and tunnels.
 */
@Service
public class DispenseMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeStreams = new AtomicInteger();

    public DispenseMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("dispense.streams.active", activeStreams, AtomicInteger::get)
                .description("Open task output streams")
                .register(registry);
    }

    public void recordTaskStarted() {
        Counter.builder("dispense.tasks.started")
                .register(registry)
                .increment();
    }

    public void recordTaskResult(TaskState state, Duration duration) {
        String outcome = state.name().toLowerCase(Locale.ROOT);
        Counter.builder("dispense.tasks.total")
                .tag("state", outcome)
                .register(registry)
                .increment();
        Timer.builder("dispense.tasks.duration")
                .tag("state", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordTaskStopped() {
        Counter.builder("dispense.tasks.stopped")
                .register(registry)
                .increment();
    }

    public void streamOpened() {
        activeStreams.incrementAndGet();
    }

    public void streamClosed() {
        activeStreams.decrementAndGet();
    }

    public int activeStreams() {
        return activeStreams.get();
    }

    /**
     * Records a daemon connection attempt.
     *
     * @param kind    "local" or "remote"
     * @param success whether an endpoint was handed out
     */
    public void recordConnection(String kind, boolean success) {
        Counter.builder("dispense.connections")
                .tag("kind", kind)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
