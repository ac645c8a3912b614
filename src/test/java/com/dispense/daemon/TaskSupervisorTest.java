package com.dispense.daemon;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.core.events.EventBus;
import com.dispense.core.events.TaskEvent;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.dispense.daemon.DaemonTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class TaskSupervisorTest {

    @TempDir
    Path tempDir;

    private DaemonProperties properties;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private TaskSupervisor supervisor;

    @BeforeEach
    void setUp() {
        properties = shellProperties(tempDir);
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        supervisor = supervisor(properties, eventBus, new DispenseMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private List<String> logLines(String taskId) throws Exception {
        return Files.readAllLines(supervisor.logPath(taskId));
    }

    // ── successful and failing runs ─────────────────────────────────

    @Nested
    @DisplayName("running tasks")
    class Running {

        @Test
        @DisplayName("a zero exit completes the task and logs every output line")
        void successfulRun() throws Exception {
            String taskId = supervisor.startTask(script("echo hello; echo oops 1>&2; sleep 0.05"));
            TaskStatus status = awaitDone(supervisor, taskId);

            assertTrue(taskId.startsWith("claude_"));
            assertEquals(TaskState.COMPLETED, status.state());
            assertEquals(0, status.exitCode());
            assertNull(status.error());
            assertEquals("Task completed successfully", status.message());
            assertNotNull(status.finishedAt());
            assertTrue(status.finishedAt() > status.startedAt());

            List<String> lines = logLines(taskId);
            assertTrue(lines.stream().anyMatch(l -> l.endsWith("[STDOUT] hello")), lines.toString());
            assertTrue(lines.stream().anyMatch(l -> l.endsWith("[STDERR] oops")), lines.toString());
            assertTrue(lines.get(lines.size() - 2).endsWith("[STATUS] Task completed successfully"));
            assertTrue(lines.get(lines.size() - 1).endsWith("[STATUS] Task completed with exit code 0"));
        }

        @Test
        @DisplayName("a non-zero exit fails the task with the exit status")
        void failingRun() throws Exception {
            String taskId = supervisor.startTask(script("echo partial; exit 3"));
            TaskStatus status = awaitDone(supervisor, taskId);

            assertEquals(TaskState.FAILED, status.state());
            assertEquals(3, status.exitCode());
            assertEquals("exit status 3", status.error());
            List<String> lines = logLines(taskId);
            assertTrue(lines.stream().anyMatch(l -> l.endsWith("[ERROR] Agent execution failed: exit status 3")));
            assertTrue(lines.get(lines.size() - 1).endsWith("[STATUS] Task completed with exit code 3"));
        }

        @Test
        @DisplayName("the prompt is passed as the last argument and env vars reach the agent")
        void passesPromptAndEnvironment() throws Exception {
            var request = new ExecuteRequest("echo \"$GREETING $ANTHROPIC_MODEL\"", null, null, "test-model",
                    Map.of("GREETING", "hi"));
            String taskId = supervisor.startTask(request);
            awaitDone(supervisor, taskId);

            assertTrue(logLines(taskId).stream().anyMatch(l -> l.endsWith("[STDOUT] hi test-model")));
        }

        @Test
        @DisplayName("lifecycle events are published in order")
        void publishesEvents() throws Exception {
            List<String> events = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(e -> events.add(e.eventType()));

            String taskId = supervisor.startTask(script("true"));
            awaitDone(supervisor, taskId);
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (events.size() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }

            assertEquals(List.of(TaskEvent.TYPE_STARTED, TaskEvent.TYPE_FINALIZED), events);
        }

        @Test
        @DisplayName("results are counted by state")
        void recordsMetrics() throws Exception {
            awaitDone(supervisor, supervisor.startTask(script("true")));
            awaitDone(supervisor, supervisor.startTask(script("exit 1")));

            assertEquals(2.0, meterRegistry.get("dispense.tasks.started").counter().count());
            assertEquals(1.0, meterRegistry.get("dispense.tasks.total").tag("state", "completed").counter().count());
            assertEquals(1.0, meterRegistry.get("dispense.tasks.total").tag("state", "failed").counter().count());
        }

        @Test
        @DisplayName("concurrent tasks get distinct ids and all finish")
        void concurrentTasks() throws Exception {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 5; i++) {
                ids.add(supervisor.startTask(script("echo task " + i)));
            }
            assertEquals(5, ids.size());
            for (String id : ids) {
                assertEquals(TaskState.COMPLETED, awaitDone(supervisor, id).state());
            }
            assertEquals(0, supervisor.activeTaskCount());
        }
    }

    // ── setup failures ──────────────────────────────────────────────

    @Nested
    @DisplayName("setup failures")
    class SetupFailures {

        @Test
        @DisplayName("a missing agent binary fails the task instead of throwing")
        void missingExecutable() throws Exception {
            properties.getAgent().setExecutable(tempDir.resolve("no-such-agent").toString());

            String taskId = supervisor.startTask(script("ignored"));
            TaskStatus status = awaitDone(supervisor, taskId);

            assertEquals(TaskState.FAILED, status.state());
            assertEquals(1, status.exitCode());
            assertTrue(status.error().startsWith("Failed to start command"), status.error());
            assertTrue(logLines(taskId).stream().anyMatch(l -> l.contains("[ERROR] Failed to start command")));
        }

        @Test
        @DisplayName("a missing working directory fails the task")
        void missingWorkingDirectory() throws Exception {
            var request = new ExecuteRequest("true", tempDir.resolve("nope").toString(), null, null, null);

            TaskStatus status = awaitDone(supervisor, supervisor.startTask(request));

            assertEquals(TaskState.FAILED, status.state());
            assertNotNull(status.error());
        }

        @Test
        @DisplayName("a blank prompt is rejected before a task exists")
        void blankPrompt() {
            var e = assertThrows(DispenseException.class, () -> supervisor.startTask(script("  ")));

            assertEquals(ErrorCode.INVALID_REQUEST, e.code());
            assertEquals(0, supervisor.taskCount());
        }
    }

    // ── stop ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stopTask")
    class Stop {

        @Test
        @DisplayName("terminates the process and records the stop")
        void stopsRunningTask() throws Exception {
            String taskId = supervisor.startTask(script("echo started; sleep 30"));
            awaitState(supervisor, taskId, TaskState.RUNNING, Duration.ofSeconds(10));
            ProcessHandle process = supervisor.processHandle(taskId).orElseThrow();

            TaskStatus stopped = supervisor.stopTask(taskId);

            assertEquals(TaskState.FAILED, stopped.state());
            assertEquals(-1, stopped.exitCode());
            assertEquals("Task was stopped by user", stopped.error());

            TaskStatus after = awaitDone(supervisor, taskId);
            assertEquals(TaskState.FAILED, after.state());
            assertEquals(-1, after.exitCode());
            assertFalse(process.isAlive());
            assertTrue(logLines(taskId).stream().anyMatch(l -> l.endsWith("[STATUS] Task stopped by user")));
            assertEquals(1.0, meterRegistry.get("dispense.tasks.stopped").counter().count());
        }

        @Test
        @DisplayName("stopping a finished task changes nothing")
        void stopFinishedTask() throws Exception {
            String taskId = supervisor.startTask(script("exit 0"));
            awaitDone(supervisor, taskId);

            TaskStatus status = supervisor.stopTask(taskId);

            assertEquals(TaskState.COMPLETED, status.state());
            assertEquals(0, status.exitCode());
        }

        @Test
        @DisplayName("unknown task is not found")
        void unknownTask() {
            var e = assertThrows(DispenseException.class, () -> supervisor.stopTask("claude_0"));
            assertEquals(ErrorCode.TASK_NOT_FOUND, e.code());
        }
    }

    // ── status, listing and cleanup ─────────────────────────────────

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("empty id before any task returns the idle answer")
        void idleStatus() {
            TaskStatus status = supervisor.getStatus("");

            assertTrue(status.isIdle());
            assertEquals(TaskState.PENDING, status.state());
            assertEquals("No tasks found - daemon is ready", status.message());
        }

        @Test
        @DisplayName("empty id returns the most recently started task")
        void latestAlias() throws Exception {
            String first = supervisor.startTask(script("true"));
            awaitDone(supervisor, first);
            String second = supervisor.startTask(script("true"));
            awaitDone(supervisor, second);

            assertEquals(second, supervisor.getStatus(null).taskId());
            assertEquals(second, supervisor.getStatus(" ").taskId());
        }

        @Test
        @DisplayName("unknown id is not found")
        void unknownStatus() {
            var e = assertThrows(DispenseException.class, () -> supervisor.getStatus("claude_42"));
            assertTrue(e.isNotFound());
        }

        @Test
        @DisplayName("listing is newest first and filters by state")
        void listing() throws Exception {
            String ok = supervisor.startTask(script("true"));
            awaitDone(supervisor, ok);
            String bad = supervisor.startTask(script("exit 2"));
            awaitDone(supervisor, bad);

            List<TaskInfo> all = supervisor.listTasks(null);
            assertEquals(List.of(bad, ok), all.stream().map(TaskInfo::taskId).toList());
            assertEquals(List.of(bad),
                    supervisor.listTasks(TaskState.FAILED).stream().map(TaskInfo::taskId).toList());
            assertTrue(supervisor.listTasks(TaskState.RUNNING).isEmpty());
        }

        @Test
        @DisplayName("cleanup refuses running tasks and forgets finished ones")
        void cleanup() throws Exception {
            String running = supervisor.startTask(script("sleep 30"));
            awaitState(supervisor, running, TaskState.RUNNING, Duration.ofSeconds(10));

            var active = assertThrows(DispenseException.class, () -> supervisor.cleanupTask(running));
            assertEquals(ErrorCode.TASK_ACTIVE, active.code());

            supervisor.stopTask(running);
            awaitDone(supervisor, running);
            supervisor.cleanupTask(running);

            assertThrows(DispenseException.class, () -> supervisor.getStatus(running));
            var missing = assertThrows(DispenseException.class, () -> supervisor.cleanupTask(running));
            assertEquals(ErrorCode.TASK_NOT_FOUND, missing.code());
        }
    }
}
