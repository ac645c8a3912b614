package com.dispense.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation scope of one task: the agent process once it exists, a cancelled flag, and a
 * future completed when the supervisor has finished with the task (log sink closed).
 */
final class TaskHandle {

    private static final Logger log = LoggerFactory.getLogger(TaskHandle.class);

    private final String taskId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<Void> finalized = new CompletableFuture<>();
    private volatile Process process;

    TaskHandle(String taskId) {
        this.taskId = taskId;
    }

    /**
     * Binds the spawned process. Returns false when the task was cancelled before the process
     * came up; the caller must then terminate it.
     */
    boolean attach(Process process) {
        this.process = process;
        return !cancelled.get();
    }

    /**
     * Cancels the task: terminates the process tree (graceful first, forced after
     * {@code grace}) and closes its pipes so pending reads return. Only the first call acts.
     */
    boolean cancel(Duration grace) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        Process p = process;
        if (p != null) {
            terminate(p, grace);
        }
        return true;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    Optional<ProcessHandle> processHandle() {
        Process p = process;
        return p == null ? Optional.empty() : Optional.of(p.toHandle());
    }

    void markFinalized() {
        finalized.complete(null);
    }

    boolean isFinalized() {
        return finalized.isDone();
    }

    CompletableFuture<Void> finalization() {
        return finalized;
    }

    void terminate(Process p, Duration grace) {
        List<ProcessHandle> tree = p.descendants().toList();
        tree.forEach(ProcessHandle::destroy);
        p.destroy();
        try {
            if (!p.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Task {} did not exit within {} ms, killing it", taskId, grace.toMillis());
                p.destroyForcibly();
                p.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        closePipe(p.getInputStream());
        closePipe(p.getErrorStream());
    }

    private void closePipe(Closeable pipe) {
        try {
            pipe.close();
        } catch (IOException e) {
            log.debug("Closing pipe of task {} failed: {}", taskId, e.getMessage());
        }
    }
}
