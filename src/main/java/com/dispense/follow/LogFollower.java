package com.dispense.follow;

import com.dispense.core.error.DispenseException;
import com.dispense.protocol.LineAssembler;
import com.dispense.protocol.StreamFrame;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.OptionalLong;

/**
 * Follows a task's output until it reaches a terminal state.
 *
 * <p>{@link #followStream} consumes frames pushed by the daemon. {@link #followFile} is the
 * fallback: it polls the task log, fetching only bytes past the last offset, and decides
 * when to stop by querying task status on every iteration rather than by watching the
 * file. A status query that fails ends the session with
 * {@link FollowOutcome#CONNECTION_LOST}.
 */
public class LogFollower {

    private static final Logger log = LoggerFactory.getLogger(LogFollower.class);

    static final int MAX_READ = 64 * 1024;

    private final LogSource source;
    private final TaskStatusProbe probe;
    private final LogRenderer renderer;
    private final Duration pollInterval;
    private final Duration missingFileRetry;
    private volatile boolean stopped;

    public LogFollower(LogSource source, TaskStatusProbe probe, LogRenderer renderer,
                       Duration pollInterval, Duration missingFileRetry) {
        this.source = source;
        this.probe = probe;
        this.renderer = renderer;
        this.pollInterval = pollInterval;
        this.missingFileRetry = missingFileRetry;
    }

    public LogFollower(LogSource source, TaskStatusProbe probe, LogRenderer renderer) {
        this(source, probe, renderer, Duration.ofMillis(500), Duration.ofSeconds(1));
    }

    /** Ends the current session at the next iteration with {@link FollowOutcome#INTERRUPTED}. */
    public void stop() {
        stopped = true;
    }

    public FollowOutcome followFile(String path) {
        LineAssembler assembler = new LineAssembler();
        long offset = 0;
        while (!stopped) {
            OptionalLong size;
            try {
                size = source.size(path);
                if (size.isPresent() && size.getAsLong() > offset) {
                    offset = readRange(path, offset, size.getAsLong(), assembler);
                }
            } catch (DispenseException e) {
                log.debug("Reading {} failed: {}", path, e.getMessage());
                size = OptionalLong.empty();
            }

            TaskStatus status;
            try {
                status = probe.status();
            } catch (RuntimeException e) {
                log.debug("Status query failed: {}", e.getMessage());
                flush(assembler);
                return FollowOutcome.CONNECTION_LOST;
            }
            if (status.state().isTerminal()) {
                offset = drainRemaining(path, offset, assembler);
                flush(assembler);
                log.debug("Task {} finished at offset {}", status.taskId(), offset);
                return outcomeOf(status.state());
            }

            if (!sleep(size.isPresent() ? pollInterval : missingFileRetry)) {
                break;
            }
        }
        flush(assembler);
        return FollowOutcome.INTERRUPTED;
    }

    /**
     * Renders frames until the final one. A stream that breaks or ends early yields
     * {@link FollowOutcome#CONNECTION_LOST}.
     */
    public FollowOutcome followStream(Iterator<StreamFrame> frames) {
        try {
            while (!stopped && frames.hasNext()) {
                StreamFrame frame = frames.next();
                renderer.renderFrame(frame);
                if (frame.finished()) {
                    return frame.succeeded() ? FollowOutcome.COMPLETED : FollowOutcome.FAILED;
                }
            }
        } catch (DispenseException e) {
            log.debug("Stream ended: {}", e.getMessage());
            return FollowOutcome.CONNECTION_LOST;
        }
        return stopped ? FollowOutcome.INTERRUPTED : FollowOutcome.CONNECTION_LOST;
    }

    private long drainRemaining(String path, long offset, LineAssembler assembler) {
        try {
            OptionalLong size = source.size(path);
            if (size.isPresent() && size.getAsLong() > offset) {
                return readRange(path, offset, size.getAsLong(), assembler);
            }
        } catch (DispenseException e) {
            log.debug("Final read of {} failed: {}", path, e.getMessage());
        }
        return offset;
    }

    private long readRange(String path, long offset, long size, LineAssembler assembler) {
        long position = offset;
        while (position < size) {
            int length = (int) Math.min(MAX_READ, size - position);
            byte[] chunk = source.read(path, position, length);
            if (chunk.length == 0) {
                break;
            }
            for (String line : assembler.push(chunk)) {
                renderer.renderLine(line);
            }
            position += chunk.length;
        }
        return position;
    }

    private void flush(LineAssembler assembler) {
        assembler.flush().ifPresent(renderer::renderLine);
    }

    private static FollowOutcome outcomeOf(TaskState state) {
        return state == TaskState.COMPLETED ? FollowOutcome.COMPLETED : FollowOutcome.FAILED;
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
