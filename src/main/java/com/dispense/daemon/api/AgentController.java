package com.dispense.daemon.api;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.daemon.TaskSupervisor;
import com.dispense.protocol.CreateTaskResponse;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.TaskListResponse;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Locale;
import java.util.Map;

/**
 * Streaming RPC surface of the daemon: start tasks with live output, attach to running
 * tasks, and query, stop or clean up tasks.
 */
@RestController
@RequestMapping("/api/v1/agent")
@ConditionalOnProperty(name = "dispense.mode", havingValue = "daemon")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    /** Response header carrying the id of the task started by {@code /execute}. */
    public static final String TASK_ID_HEADER = "X-Task-Id";

    private final TaskSupervisor supervisor;
    private final TaskStreamingService streamingService;

    public AgentController(TaskSupervisor supervisor, TaskStreamingService streamingService) {
        this.supervisor = supervisor;
        this.streamingService = streamingService;
    }

    /**
     * POST /api/v1/agent/execute: Start a task and stream its output until it finishes.
     */
    @PostMapping(value = "/execute", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> execute(@RequestBody ExecuteRequest request, HttpServletResponse response) {
        if (!request.hasPrompt()) {
            throw promptRequired();
        }
        String taskId = supervisor.startTask(request);
        log.info("Streaming new task {}", taskId);
        // Set on the servlet response so the header is committed before the first frame.
        response.setHeader(TASK_ID_HEADER, taskId);
        return ResponseEntity.ok(streamingService.createEmitter(taskId));
    }

    /**
     * GET /api/v1/agent/tasks/{id}/stream: Attach to a task's output from the beginning.
     */
    @GetMapping(value = "/tasks/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@PathVariable String id) {
        try {
            return ResponseEntity.ok(streamingService.createEmitter(id));
        } catch (DispenseException e) {
            if (e.isNotFound()) {
                return ResponseEntity.notFound().build();
            }
            throw e;
        }
    }

    /**
     * POST /api/v1/agent/tasks: Start a task without streaming.
     */
    @PostMapping("/tasks")
    public ResponseEntity<?> createTask(@RequestBody ExecuteRequest request) {
        if (!request.hasPrompt()) {
            return error(promptRequired());
        }
        String taskId = supervisor.startTask(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new CreateTaskResponse(true, taskId, "Task started"));
    }

    /**
     * GET /api/v1/agent/status?task_id=: Status of one task; no id means the latest task.
     */
    @GetMapping("/status")
    public ResponseEntity<?> status(@RequestParam(name = "task_id", required = false) String taskId) {
        try {
            return ResponseEntity.ok(supervisor.getStatus(taskId));
        } catch (DispenseException e) {
            return error(e);
        }
    }

    /**
     * GET /api/v1/agent/tasks?state=: All tasks, newest first.
     */
    @GetMapping("/tasks")
    public ResponseEntity<?> listTasks(@RequestParam(name = "state", required = false) String state) {
        TaskState filter = null;
        if (state != null && !state.isBlank()) {
            try {
                filter = TaskState.valueOf(state.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return error(new DispenseException(ErrorCode.INVALID_REQUEST, "Unknown task state: " + state));
            }
        }
        return ResponseEntity.ok(new TaskListResponse(supervisor.listTasks(filter)));
    }

    @PostMapping("/tasks/{id}/stop")
    public ResponseEntity<?> stop(@PathVariable String id) {
        try {
            TaskStatus status = supervisor.stopTask(id);
            return ResponseEntity.ok(status);
        } catch (DispenseException e) {
            return error(e);
        }
    }

    @DeleteMapping("/tasks/{id}")
    public ResponseEntity<?> cleanup(@PathVariable String id) {
        try {
            supervisor.cleanupTask(id);
            return ResponseEntity.noContent().build();
        } catch (DispenseException e) {
            return error(e);
        }
    }

    @ExceptionHandler(DispenseException.class)
    public ResponseEntity<Map<String, String>> handleDispenseException(DispenseException e) {
        return error(e);
    }

    private static DispenseException promptRequired() {
        return new DispenseException(ErrorCode.INVALID_REQUEST, "prompt is required");
    }

    private ResponseEntity<Map<String, String>> error(DispenseException e) {
        HttpStatus status = switch (e.code()) {
            case TASK_NOT_FOUND, SANDBOX_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TASK_ACTIVE -> HttpStatus.CONFLICT;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        // Explicit JSON so the error body is also writable from the event-stream mappings.
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage(), "code", e.code().name()));
    }
}
