package com.dispense.daemon;

import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;

import java.time.Instant;

/**
 * Registry record of one task. Mutable fields are only touched under the registry lock;
 * the sink and handle are fixed at creation and safe to use outside it.
 */
final class Task {

    private final String id;
    private final String prompt;
    private final String workingDirectory;
    private final Instant startedAt;
    private final TaskLogSink sink;
    private final TaskHandle handle;

    private TaskState state = TaskState.PENDING;
    private Instant finishedAt;
    private Integer exitCode;
    private String error;

    Task(String id, String prompt, String workingDirectory, Instant startedAt, TaskLogSink sink) {
        this.id = id;
        this.prompt = prompt;
        this.workingDirectory = workingDirectory;
        this.startedAt = startedAt;
        this.sink = sink;
        this.handle = new TaskHandle(id);
    }

    String id() { return id; }
    String workingDirectory() { return workingDirectory; }
    Instant startedAt() { return startedAt; }
    TaskState state() { return state; }
    TaskLogSink sink() { return sink; }
    TaskHandle handle() { return handle; }

    /**
     * Moves the task forward. Returns false, leaving the task untouched, when the move would
     * go backwards or leave a terminal state.
     */
    boolean transitionTo(TaskState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        state = next;
        return true;
    }

    /** Terminal transition with its outcome fields; no-op if the task already finished. */
    boolean finish(TaskState terminal, int exitCode, String error) {
        if (!transitionTo(terminal)) {
            return false;
        }
        this.finishedAt = Instant.now();
        this.exitCode = exitCode;
        this.error = error;
        return true;
    }

    TaskStatus toStatus() {
        return new TaskStatus(id, state, state.describe(), prompt, workingDirectory,
                startedAt.toEpochMilli(),
                finishedAt == null ? null : finishedAt.toEpochMilli(),
                exitCode, error);
    }

    TaskInfo toInfo() {
        return new TaskInfo(id, prompt, state, workingDirectory,
                startedAt.toEpochMilli(),
                finishedAt == null ? null : finishedAt.toEpochMilli(),
                exitCode, error);
    }
}
