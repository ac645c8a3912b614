package com.dispense.daemon.api;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.daemon.TaskSupervisor;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@TestPropertySource(properties = {
        "spring.main.web-application-type=servlet",
        "dispense.mode=daemon"
})
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskSupervisor supervisor;

    @MockitoBean
    private TaskStreamingService streamingService;

    private static TaskStatus running(String id) {
        return new TaskStatus(id, TaskState.RUNNING, "Task is currently running", "do it", "/workspace",
                1_700_000_000_000L, null, null, null);
    }

    // ── POST /execute ────────────────────────────────────────────────

    @Test
    @DisplayName("POST /execute starts a task and opens its stream")
    void executeStreams() throws Exception {
        when(supervisor.startTask(any(ExecuteRequest.class))).thenReturn("claude_1");
        when(streamingService.createEmitter("claude_1")).thenReturn(new SseEmitter());

        mockMvc.perform(post("/api/v1/agent/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content("{\"prompt\":\"fix the build\",\"working_directory\":\"/workspace/app\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Task-Id", "claude_1"))
                .andExpect(request().asyncStarted());

        verify(supervisor).startTask(argThat(r ->
                "fix the build".equals(r.prompt()) && "/workspace/app".equals(r.workingDirectory())));
    }

    @Test
    @DisplayName("POST /execute with a blank prompt is a 400 and starts nothing")
    void executeBlankPrompt() throws Exception {
        mockMvc.perform(post("/api/v1/agent/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error").value("prompt is required"));

        verifyNoInteractions(supervisor);
    }

    // ── POST /tasks ──────────────────────────────────────────────────

    @Test
    @DisplayName("POST /tasks returns 202 with the task id")
    void createTask() throws Exception {
        when(supervisor.startTask(any(ExecuteRequest.class))).thenReturn("claude_7");

        mockMvc.perform(post("/api/v1/agent/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"write tests\",\"environment_vars\":{\"A\":\"1\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.task_id").value("claude_7"));

        verify(supervisor).startTask(argThat(r -> "1".equals(r.environmentVars().get("A"))));
    }

    @Test
    @DisplayName("POST /tasks without prompt is a 400 with INVALID_REQUEST")
    void createTaskWithoutPrompt() throws Exception {
        mockMvc.perform(post("/api/v1/agent/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error").value("prompt is required"));

        verifyNoInteractions(supervisor);
    }

    // ── GET /status ──────────────────────────────────────────────────

    @Test
    @DisplayName("GET /status without id returns the latest task")
    void statusLatest() throws Exception {
        when(supervisor.getStatus(isNull())).thenReturn(running("claude_9"));

        mockMvc.perform(get("/api/v1/agent/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value("claude_9"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.started_at").value(1_700_000_000_000L))
                .andExpect(jsonPath("$.exit_code").doesNotExist());
    }

    @Test
    @DisplayName("GET /status with unknown id is 404 with TASK_NOT_FOUND")
    void statusUnknown() throws Exception {
        when(supervisor.getStatus("claude_x")).thenThrow(DispenseException.taskNotFound("claude_x"));

        mockMvc.perform(get("/api/v1/agent/status").param("task_id", "claude_x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TASK_NOT_FOUND"));
    }

    // ── GET /tasks ───────────────────────────────────────────────────

    @Test
    @DisplayName("GET /tasks passes the state filter through")
    void listTasks() throws Exception {
        when(supervisor.listTasks(TaskState.RUNNING)).thenReturn(List.of(
                new TaskInfo("claude_2", "b", TaskState.RUNNING, "/workspace", 2L, null, null, null)));

        mockMvc.perform(get("/api/v1/agent/tasks").param("state", "running"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks[0].task_id").value("claude_2"))
                .andExpect(jsonPath("$.tasks.length()").value(1));
    }

    @Test
    @DisplayName("GET /tasks with an unknown state is 400")
    void listTasksBadState() throws Exception {
        mockMvc.perform(get("/api/v1/agent/tasks").param("state", "SLEEPING"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    // ── stream, stop, cleanup ────────────────────────────────────────

    @Test
    @DisplayName("GET /tasks/{id}/stream for unknown task is 404")
    void streamUnknown() throws Exception {
        when(streamingService.createEmitter("claude_0")).thenThrow(DispenseException.taskNotFound("claude_0"));

        mockMvc.perform(get("/api/v1/agent/tasks/claude_0/stream"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /tasks/{id}/stop returns the stopped status")
    void stopTask() throws Exception {
        when(supervisor.stopTask("claude_3")).thenReturn(new TaskStatus("claude_3", TaskState.FAILED, "Task failed",
                "p", "/workspace", 1L, 2L, -1, "Task was stopped by user"));

        mockMvc.perform(post("/api/v1/agent/tasks/claude_3/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exit_code").value(-1))
                .andExpect(jsonPath("$.error").value("Task was stopped by user"));
    }

    @Test
    @DisplayName("DELETE /tasks/{id} is 204, or 409 while running")
    void cleanupTask() throws Exception {
        mockMvc.perform(delete("/api/v1/agent/tasks/claude_4"))
                .andExpect(status().isNoContent());
        verify(supervisor).cleanupTask(eq("claude_4"));

        doThrow(new DispenseException(ErrorCode.TASK_ACTIVE, "Cannot clean up running task: claude_5"))
                .when(supervisor).cleanupTask("claude_5");
        mockMvc.perform(delete("/api/v1/agent/tasks/claude_5"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TASK_ACTIVE"));
    }
}
