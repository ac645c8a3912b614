package com.dispense.daemon;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.core.events.EventBus;
import com.dispense.core.events.TaskEvent;
import com.dispense.core.logging.MdcContext;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.FrameType;
import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs agent tasks as subprocesses and tracks them in the {@link TaskRegistry}.
 * <p>
 * Each task gets one supervising thread plus one reader per output pipe. Every output line
 * goes to the task's log sink (and the daemon log) as it arrives. When the process exits the
 * supervisor records the terminal state, writes the completion lines and closes the sink;
 * a stopped task goes through the same finalization.
 */
public class TaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    static final String STOPPED_ERROR = "Task was stopped by user";
    static final int STOPPED_EXIT_CODE = -1;

    private final TaskRegistry registry;
    private final TaskIdGenerator idGenerator;
    private final AgentInvocation invocation;
    private final AgentConfigurer configurer;
    private final DaemonProperties properties;
    private final EventBus eventBus;
    private final DispenseMetrics metrics;
    private final ExecutorService executor;

    public TaskSupervisor(TaskRegistry registry,
                          TaskIdGenerator idGenerator,
                          AgentInvocation invocation,
                          AgentConfigurer configurer,
                          DaemonProperties properties,
                          EventBus eventBus,
                          DispenseMetrics metrics) {
        this.registry = registry;
        this.idGenerator = idGenerator;
        this.invocation = invocation;
        this.configurer = configurer;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        createLogDirectory();
    }

    /**
     * Starts a task and returns its id right away. Setup problems (log file, working
     * directory, missing binary) do not throw: the task is recorded as FAILED with the reason.
     */
    public String startTask(ExecuteRequest request) {
        if (request == null || !request.hasPrompt()) {
            throw new DispenseException(ErrorCode.INVALID_REQUEST, "prompt is required");
        }
        String taskId = idGenerator.next();
        String workDir = request.workingDirectory() == null || request.workingDirectory().isBlank()
                ? properties.getDefaultWorkingDirectory()
                : request.workingDirectory();
        Path logPath = properties.logDirectory().resolve(taskId + ".log");

        TaskLogSink sink;
        String sinkError = null;
        try {
            sink = TaskLogSink.open(logPath);
        } catch (IOException e) {
            sink = TaskLogSink.unavailable(logPath);
            sinkError = "Failed to create log file: " + e.getMessage();
        }

        Task task = new Task(taskId, request.prompt(), workDir, Instant.now(), sink);
        registry.register(task);
        if (metrics != null) {
            metrics.recordTaskStarted();
        }
        log.info("Task {} created (workdir={}, log={})", taskId, workDir, logPath);

        if (sinkError != null) {
            failSetup(task, sinkError);
            finalizeTask(task);
            return taskId;
        }
        try {
            executor.execute(() -> supervise(task, request));
        } catch (RejectedExecutionException e) {
            failSetup(task, "Supervisor is shutting down");
            finalizeTask(task);
        }
        return taskId;
    }

    /**
     * Stops a running task: records it as FAILED by the user, then terminates the process.
     * Stopping a finished task is a no-op that returns its current status.
     */
    public TaskStatus stopTask(String taskId) {
        Task task = registry.find(taskId).orElseThrow(() -> DispenseException.taskNotFound(taskId));
        boolean stopped = registry.withTask(taskId,
                t -> t.finish(TaskState.FAILED, STOPPED_EXIT_CODE, STOPPED_ERROR)).orElse(false);
        if (stopped) {
            log.info("Stopping task {}", taskId);
            task.sink().append(FrameType.STATUS, "Task stopped by user");
            eventBus.publish(TaskEvent.of(TaskEvent.TYPE_STOPPED, taskId, Map.of()));
            if (metrics != null) {
                metrics.recordTaskStopped();
            }
            task.handle().cancel(properties.getStopGrace());
        }
        return getStatus(taskId);
    }

    /** Status of one task; a null or blank id means the most recently started task. */
    public TaskStatus getStatus(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return registry.latestStatus();
        }
        return registry.status(taskId).orElseThrow(() -> DispenseException.taskNotFound(taskId));
    }

    public List<TaskInfo> listTasks(TaskState filter) {
        return registry.list(filter);
    }

    /** Forgets a finished task. Its log file stays on disk. */
    public void cleanupTask(String taskId) {
        try {
            registry.removeFinished(taskId).orElseThrow(() -> DispenseException.taskNotFound(taskId));
            log.info("Task {} removed from registry", taskId);
        } catch (IllegalStateException e) {
            throw new DispenseException(ErrorCode.TASK_ACTIVE, "Cannot clean up running task: " + taskId, e);
        }
    }

    public Path logPath(String taskId) {
        return registry.withTask(taskId, t -> t.sink().path())
                .orElseThrow(() -> DispenseException.taskNotFound(taskId));
    }

    /** True once the task's log sink is closed and no further lines will be written. */
    public boolean isFinalized(String taskId) {
        return registry.withTask(taskId, t -> t.handle().isFinalized())
                .orElseThrow(() -> DispenseException.taskNotFound(taskId));
    }

    public boolean awaitFinalized(String taskId, Duration timeout) throws InterruptedException {
        TaskHandle handle = registry.withTask(taskId, Task::handle)
                .orElseThrow(() -> DispenseException.taskNotFound(taskId));
        try {
            handle.finalization().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Finalization of task " + taskId + " failed", e.getCause());
        }
    }

    public int activeTaskCount() {
        return registry.active().size();
    }

    public int taskCount() {
        return registry.size();
    }

    Optional<ProcessHandle> processHandle(String taskId) {
        return registry.withTask(taskId, Task::handle).flatMap(TaskHandle::processHandle);
    }

    /** Stops every active task and the worker pool. */
    public void shutdown() {
        for (Task task : registry.active()) {
            log.info("Daemon shutting down, stopping task {}", task.id());
            stopTask(task.id());
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getStopGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void supervise(Task task, ExecuteRequest request) {
        String taskId = task.id();
        MdcContext.setTask(taskId);
        try {
            configurer.ensureConfigured();
            if (task.handle().isCancelled()) {
                return;
            }
            Process process;
            try {
                process = invocation.processBuilder(request, task.workingDirectory()).start();
            } catch (IOException e) {
                failSetup(task, "Failed to start command: " + e.getMessage());
                return;
            }
            process.getOutputStream().close();
            if (!task.handle().attach(process)) {
                task.handle().terminate(process, properties.getStopGrace());
                return;
            }
            registry.withTask(taskId, t -> t.transitionTo(TaskState.RUNNING));
            eventBus.publish(TaskEvent.of(TaskEvent.TYPE_STARTED, taskId, Map.of("pid", process.pid())));
            log.info("Task {} started with PID: {}", taskId, process.pid());

            Future<?> stdout = executor.submit(() -> drain(task, process.getInputStream(), FrameType.STDOUT));
            Future<?> stderr = executor.submit(() -> drain(task, process.getErrorStream(), FrameType.STDERR));

            int exitCode = process.waitFor();
            awaitReader(task, stdout, process);
            awaitReader(task, stderr, process);
            complete(task, exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.handle().cancel(properties.getStopGrace());
            failSetup(task, "Supervisor interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("Supervisor error for task {}: {}", taskId, e.getMessage(), e);
            task.handle().cancel(properties.getStopGrace());
            failSetup(task, "Supervisor error: " + e.getMessage());
        } finally {
            finalizeTask(task);
            MdcContext.clear();
        }
    }

    private void drain(Task task, InputStream pipe, FrameType type) {
        MdcContext.setTask(task.id());
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(pipe, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                task.sink().append(type, line);
                log.info("Task {} [{}]: {}", task.id(), type, line);
            }
        } catch (IOException e) {
            if (!task.handle().isCancelled()) {
                log.warn("Error reading {} of task {}: {}", type, task.id(), e.getMessage());
                task.sink().append(FrameType.ERROR, "Error reading " + type + ": " + e.getMessage());
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Waits for a reader to hit end of stream. A grandchild holding the pipe open past the
     * agent's exit would block it forever, so after the grace period the pipes are closed.
     */
    private void awaitReader(Task task, Future<?> reader, Process process) throws InterruptedException {
        try {
            reader.get(properties.getStopGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Output of task {} still open after exit, closing pipes", task.id());
            task.handle().terminate(process, Duration.ZERO);
            waitQuietly(reader);
        } catch (ExecutionException e) {
            log.warn("Reader for task {} failed: {}", task.id(), e.getCause().getMessage());
        }
    }

    private void waitQuietly(Future<?> reader) throws InterruptedException {
        try {
            reader.get(properties.getStopGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.debug("Reader did not finish after pipes were closed: {}", e.toString());
        }
    }

    private void complete(Task task, int exitCode) {
        boolean success = exitCode == 0;
        String error = success ? null : "exit status " + exitCode;
        boolean recorded = registry.withTask(task.id(),
                t -> t.finish(success ? TaskState.COMPLETED : TaskState.FAILED, exitCode, error)).orElse(false);
        if (recorded) {
            if (success) {
                task.sink().append(FrameType.STATUS, "Task completed successfully");
            } else {
                task.sink().append(FrameType.ERROR, "Agent execution failed: " + error);
            }
            log.info("Task {} finished with exit code {}", task.id(), exitCode);
        }
        task.sink().append(FrameType.STATUS, "Task completed with exit code " + exitCode);
    }

    private void failSetup(Task task, String message) {
        boolean recorded = registry.withTask(task.id(), t -> t.finish(TaskState.FAILED, 1, message)).orElse(false);
        if (recorded) {
            log.error("Task {} failed: {}", task.id(), message);
            task.sink().append(FrameType.ERROR, message);
        }
    }

    private void finalizeTask(Task task) {
        task.sink().close();
        TaskStatus status = registry.status(task.id()).orElse(null);
        if (metrics != null && status != null && status.state().isTerminal()) {
            long end = status.finishedAt() == null ? System.currentTimeMillis() : status.finishedAt();
            metrics.recordTaskResult(status.state(), Duration.ofMillis(Math.max(0, end - status.startedAt())));
        }
        task.handle().markFinalized();
        eventBus.publish(TaskEvent.of(TaskEvent.TYPE_FINALIZED, task.id(),
                Map.of("state", status == null ? "UNKNOWN" : status.state().name())));
    }

    private void createLogDirectory() {
        try {
            Files.createDirectories(properties.logDirectory());
        } catch (IOException e) {
            log.warn("Could not create log directory {}: {}", properties.logDirectory(), e.getMessage());
        }
    }
}
