package com.dispense.daemon.api;

import com.dispense.client.DaemonClient;
import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.protocol.CreateTaskResponse;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.FrameType;
import com.dispense.protocol.StreamFrame;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import com.dispense.tunnel.DaemonEndpoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the daemon on a random port with {@code /bin/sh -c} as the agent and drives it
 * through {@link DaemonClient}, so every prompt below is a shell script.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"dispense.mode=daemon", "spring.main.web-application-type=servlet"})
class DaemonEndToEndTest {

    private static final Path WORK_DIR = createWorkDir();

    @DynamicPropertySource
    static void daemonProperties(DynamicPropertyRegistry registry) {
        registry.add("dispense.daemon.log-dir", () -> WORK_DIR.resolve("logs").toString());
        registry.add("dispense.daemon.default-working-directory", WORK_DIR::toString);
        registry.add("dispense.daemon.agent.executable", () -> "/bin/sh");
        registry.add("dispense.daemon.agent.arguments", () -> "-c");
        registry.add("dispense.daemon.agent.setup-commands", () -> "");
        registry.add("dispense.daemon.tail-interval", () -> "20ms");
        registry.add("dispense.daemon.stop-grace", () -> "2s");
    }

    private static Path createWorkDir() {
        try {
            Path dir = Files.createTempDirectory("dispense-e2e");
            Files.createDirectories(dir.resolve("logs"));
            return dir;
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private ObjectMapper objectMapper;

    private DaemonClient client;

    @BeforeEach
    void setUp() {
        client = DaemonClient.connect(DaemonEndpoint.direct("127.0.0.1", port), objectMapper, Duration.ofSeconds(10));
    }

    private static ExecuteRequest script(String script) {
        return new ExecuteRequest(script, null, null, null, Map.of());
    }

    private static List<String> contents(List<StreamFrame> frames, FrameType type) {
        return frames.stream().filter(f -> f.type() == type).map(StreamFrame::content).toList();
    }

    private TaskStatus awaitState(String taskId, TaskState state) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        TaskStatus status = client.getTaskStatus(taskId);
        while (status.state() != state && System.nanoTime() < deadline) {
            Thread.sleep(20);
            status = client.getTaskStatus(taskId);
        }
        assertEquals(state, status.state(), "task " + taskId);
        return status;
    }

    @Test
    @DisplayName("execute reports the started task id before the first frame")
    void executeReportsTaskId() throws InterruptedException {
        try (var stream = client.openExecution(script("echo id"))) {
            String taskId = stream.taskId();
            assertNotNull(taskId);
            assertTrue(taskId.startsWith("claude_"));
            assertEquals(0, stream.drainTo(frame -> { }).exitCode());
            assertEquals(TaskState.COMPLETED, awaitState(taskId, TaskState.COMPLETED).state());
        }
    }

    @Test
    @DisplayName("execute streams stdout in order and ends with exit code 0")
    void executeSucceeds() {
        var frames = new ArrayList<StreamFrame>();

        StreamFrame last = client.executeAndStream(script("echo hello; echo world"), frames::add);

        assertTrue(last.finished());
        assertTrue(last.succeeded());
        assertEquals("Task completed with exit code 0", last.content());
        assertEquals(List.of("hello", "world"), contents(frames, FrameType.STDOUT));
        assertFalse(frames.stream().anyMatch(StreamFrame::finished));
    }

    @Test
    @DisplayName("failing agent streams stderr and an error frame")
    void executeFails() {
        var frames = new ArrayList<StreamFrame>();

        StreamFrame last = client.executeAndStream(script("echo oops >&2; exit 3"), frames::add);

        assertEquals(3, last.exitCode());
        assertFalse(last.succeeded());
        assertTrue(contents(frames, FrameType.STDERR).contains("oops"));
        assertTrue(contents(frames, FrameType.ERROR).contains("Agent execution failed: exit status 3"));
    }

    @Test
    @DisplayName("blank prompt is rejected before a task is created")
    void blankPrompt() {
        var e = assertThrows(DispenseException.class, () -> client.createTask(script("  ")));
        assertEquals(ErrorCode.INVALID_REQUEST, e.code());
        assertEquals("prompt is required", e.getMessage());

        var streamed = assertThrows(DispenseException.class, () -> client.openExecution(script("")));
        assertEquals(ErrorCode.INVALID_REQUEST, streamed.code());
    }

    @Test
    @DisplayName("detached task can be attached to, then queried and listed")
    void detachedThenAttach() throws InterruptedException {
        CreateTaskResponse created = client.createTask(script("sleep 0.3; echo late"));
        assertTrue(created.success());
        String taskId = created.taskId();
        assertTrue(taskId.startsWith("claude_"));

        var frames = new ArrayList<StreamFrame>();
        StreamFrame last = client.attach(taskId, frames::add);

        assertEquals(0, last.exitCode());
        assertTrue(contents(frames, FrameType.STDOUT).contains("late"));

        TaskStatus status = awaitState(taskId, TaskState.COMPLETED);
        assertEquals(0, status.exitCode());
        assertNotNull(status.finishedAt());
        assertEquals("sleep 0.3; echo late", status.prompt());

        assertTrue(client.listTasks(TaskState.COMPLETED).stream().anyMatch(t -> t.taskId().equals(taskId)));
        assertTrue(client.listTasks(TaskState.RUNNING).stream().noneMatch(t -> t.taskId().equals(taskId)));
    }

    @Test
    @DisplayName("attaching to a finished task replays its output")
    void attachAfterFinish() throws InterruptedException {
        String taskId = client.createTask(script("echo replayed")).taskId();
        awaitState(taskId, TaskState.COMPLETED);

        var frames = new ArrayList<StreamFrame>();
        StreamFrame last = client.attach(taskId, frames::add);

        assertEquals(0, last.exitCode());
        assertEquals(List.of("replayed"), contents(frames, FrameType.STDOUT));
    }

    @Test
    @DisplayName("stop ends a running task with exit code -1, after which it can be removed")
    void stopAndCleanup() throws InterruptedException {
        String taskId = client.createTask(script("sleep 30")).taskId();
        awaitState(taskId, TaskState.RUNNING);

        var active = assertThrows(DispenseException.class, () -> client.cleanupTask(taskId));
        assertEquals(ErrorCode.TASK_ACTIVE, active.code());

        TaskStatus stopped = client.stopTask(taskId);
        assertEquals(TaskState.FAILED, stopped.state());
        assertEquals(-1, stopped.exitCode());
        assertEquals("Task was stopped by user", stopped.error());

        StreamFrame last = client.attach(taskId, frame -> { });
        assertEquals(-1, last.exitCode());

        client.cleanupTask(taskId);
        var gone = assertThrows(DispenseException.class, () -> client.getTaskStatus(taskId));
        assertEquals(ErrorCode.TASK_NOT_FOUND, gone.code());
    }

    @Test
    @DisplayName("unknown task ids map to TASK_NOT_FOUND")
    void unknownTask() {
        var status = assertThrows(DispenseException.class, () -> client.getTaskStatus("claude_0_0"));
        assertEquals(ErrorCode.TASK_NOT_FOUND, status.code());

        var stream = assertThrows(DispenseException.class, () -> client.attach("claude_0_0", frame -> { }));
        assertEquals(ErrorCode.TASK_NOT_FOUND, stream.code());

        var stop = assertThrows(DispenseException.class, () -> client.stopTask("claude_0_0"));
        assertEquals(ErrorCode.TASK_NOT_FOUND, stop.code());
    }

    @Test
    @DisplayName("health reports the supervisor, log directory and agent")
    void health() throws Exception {
        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/v1/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        JsonNode body = objectMapper.readTree(response.body());
        assertEquals("UP", body.path("status").asText());
        assertEquals("UP", body.path("components").path("supervisor").path("status").asText());
        assertEquals("UP", body.path("components").path("log-directory").path("status").asText());
        assertEquals("UP", body.path("components").path("agent").path("status").asText());
        assertTrue(body.path("total_tasks").isInt());
        assertTrue(body.path("active_streams").isInt());
    }
}
