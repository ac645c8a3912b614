package com.dispense.client;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.protocol.CreateTaskResponse;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.StreamFrame;
import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskListResponse;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import com.dispense.tunnel.DaemonEndpoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for a sandbox daemon's HTTP and SSE surface.
 * <p>
 * Errors come back as {@link DispenseException}: an unknown task is
 * {@link ErrorCode#TASK_NOT_FOUND}, a rejected request is {@link ErrorCode#INVALID_REQUEST},
 * anything that prevents talking to the daemon is {@link ErrorCode#DAEMON_UNAVAILABLE}.
 */
public class DaemonClient {

    private static final String API = "/api/v1/agent";
    private static final String TASK_ID_HEADER = "X-Task-Id";

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public DaemonClient(URI baseUri, HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.baseUri = baseUri;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    public static DaemonClient connect(DaemonEndpoint endpoint, ObjectMapper objectMapper, Duration requestTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        return new DaemonClient(endpoint.baseUri(), httpClient, objectMapper, requestTimeout);
    }

    /**
     * Status of one task, or of the latest task when {@code taskId} is null or blank.
     * Bounded by the request timeout.
     */
    public TaskStatus getTaskStatus(String taskId) {
        String query = taskId == null || taskId.isBlank() ? "" : "?task_id=" + encode(taskId);
        HttpRequest request = jsonRequest(API + "/status" + query).GET().build();
        return read(send(request, taskId), TaskStatus.class);
    }

    public List<TaskInfo> listTasks(TaskState filter) {
        String query = filter == null ? "" : "?state=" + filter.name();
        HttpRequest request = jsonRequest(API + "/tasks" + query).GET().build();
        return read(send(request, null), TaskListResponse.class).tasks();
    }

    public CreateTaskResponse createTask(ExecuteRequest executeRequest) {
        HttpRequest request = jsonRequest(API + "/tasks")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(write(executeRequest)))
                .build();
        return read(send(request, null), CreateTaskResponse.class);
    }

    public TaskStatus stopTask(String taskId) {
        HttpRequest request = jsonRequest(API + "/tasks/" + encode(taskId) + "/stop")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return read(send(request, taskId), TaskStatus.class);
    }

    public void cleanupTask(String taskId) {
        HttpRequest request = jsonRequest(API + "/tasks/" + encode(taskId))
                .DELETE()
                .build();
        send(request, taskId);
    }

    /**
     * Starts a task and delivers its frames to {@code consumer} until the final frame,
     * which is returned rather than delivered.
     */
    public StreamFrame executeAndStream(ExecuteRequest executeRequest, Consumer<StreamFrame> consumer) {
        try (FrameStream stream = openExecution(executeRequest)) {
            return stream.drainTo(consumer);
        }
    }

    /**
     * Starts a task and returns its frame stream; the caller closes it.
     * {@link FrameStream#taskId()} carries the id the daemon assigned.
     */
    public FrameStream openExecution(ExecuteRequest executeRequest) {
        HttpRequest request = streamRequest(API + "/execute")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(write(executeRequest)))
                .build();
        return open(request, null);
    }

    /** Like {@link #executeAndStream}, for a task that is already running or finished. */
    public StreamFrame attach(String taskId, Consumer<StreamFrame> consumer) {
        try (FrameStream stream = openStream(taskId)) {
            return stream.drainTo(consumer);
        }
    }

    /** Opens the frame stream of a task; closing it detaches without affecting the task. */
    public FrameStream openStream(String taskId) {
        HttpRequest request = streamRequest(API + "/tasks/" + encode(taskId) + "/stream").GET().build();
        return open(request, taskId);
    }

    private FrameStream open(HttpRequest request, String taskId) {
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw unavailable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Interrupted while connecting to daemon", e);
        }
        if (response.statusCode() != 200) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = lines.collect(Collectors.joining("\n"));
            } catch (UncheckedIOException e) {
                body = null;
            }
            throw statusError(response.statusCode(), body, taskId);
        }
        String startedId = response.headers().firstValue(TASK_ID_HEADER).orElse(taskId);
        return new FrameStream(response.body(), objectMapper, startedId);
    }

    private String send(HttpRequest request, String taskId) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw unavailable(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Interrupted while calling daemon", e);
        }
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw statusError(status, response.body(), taskId);
    }

    private DispenseException statusError(int status, String body, String taskId) {
        ErrorCode code = errorCode(body);
        String message = errorMessage(body);
        if (status == 404) {
            return new DispenseException(code != null ? code : ErrorCode.TASK_NOT_FOUND,
                    message != null ? message : "Task not found: " + taskId);
        }
        if (code != null) {
            return new DispenseException(code, message != null ? message : "HTTP " + status);
        }
        if (status == 400) {
            return new DispenseException(ErrorCode.INVALID_REQUEST,
                    message != null ? message : "Daemon rejected the request");
        }
        return new DispenseException(ErrorCode.DAEMON_UNAVAILABLE,
                "Daemon returned HTTP " + status + (message != null ? ": " + message : ""));
    }

    private ErrorCode errorCode(String body) {
        JsonNode node = errorNode(body);
        if (node == null || !node.hasNonNull("code")) {
            return null;
        }
        try {
            return ErrorCode.valueOf(node.get("code").asText());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private String errorMessage(String body) {
        JsonNode node = errorNode(body);
        return node == null || !node.hasNonNull("error") ? null : node.get("error").asText();
    }

    private JsonNode errorNode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            return null;
        }
    }

    private HttpRequest.Builder jsonRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(baseUri.resolve(path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
    }

    private HttpRequest.Builder streamRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(baseUri.resolve(path))
                .header("Accept", "text/event-stream");
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Unreadable daemon response: " + e.getMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.INVALID_REQUEST, "Cannot encode request: " + e.getMessage(), e);
        }
    }

    private DispenseException unavailable(IOException e) {
        return new DispenseException(ErrorCode.DAEMON_UNAVAILABLE,
                "Cannot reach daemon at " + baseUri + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), e);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
