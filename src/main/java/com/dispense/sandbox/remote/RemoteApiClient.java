package com.dispense.sandbox.remote;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.sandbox.ExecResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * HTTP client for the remote sandbox control plane.
 *
 * <p>Every call authenticates with the configured API key as a bearer token. HTTP 401/403
 * map to {@link ErrorCode#PROVIDER_AUTH_FAILED}, 404 to {@link ErrorCode#SANDBOX_NOT_FOUND},
 * anything else that fails to {@link ErrorCode#PROVIDER_UNAVAILABLE}.
 */
public class RemoteApiClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteApiClient.class);

    private final RemoteProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteApiClient(RemoteProperties properties, ObjectMapper objectMapper) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), objectMapper);
    }

    RemoteApiClient(RemoteProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> listSandboxes() {
        JsonNode response = send("GET", "/sandbox", null);
        JsonNode items = response.isArray() ? response : response.path("items");
        var sandboxes = new ArrayList<JsonNode>();
        items.forEach(sandboxes::add);
        return sandboxes;
    }

    public JsonNode getSandbox(String id) {
        return send("GET", "/sandbox/" + encode(id), null);
    }

    public JsonNode createSandbox(ObjectNode body) {
        JsonNode created = send("POST", "/sandbox", body.toString());
        log.info("Created remote sandbox {} (state={})", created.path("id").asText(), created.path("state").asText());
        return created;
    }

    public void startSandbox(String id) {
        send("POST", "/sandbox/" + encode(id) + "/start", "{}");
    }

    public void deleteSandbox(String id) {
        send("DELETE", "/sandbox/" + encode(id), null);
        log.info("Deleted remote sandbox {}", id);
    }

    public SshAccess createSshAccess(String id, int expiresInMinutes) {
        JsonNode response = send("POST",
                "/sandbox/" + encode(id) + "/ssh-access?expiresInMinutes=" + expiresInMinutes, "{}");
        String token = response.path("token").asText(null);
        if (token == null || token.isBlank()) {
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE, "SSH access response had no token");
        }
        return new SshAccess(token, response.path("expiresAt").asText(null));
    }

    public ExecResult executeCommand(String id, String command, String cwd) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("command", command);
        if (cwd != null) {
            body.put("cwd", cwd);
        }
        JsonNode response = send("POST", "/toolbox/" + encode(id) + "/toolbox/process/execute", body.toString());
        return new ExecResult(response.path("result").asText(""), "", response.path("exitCode").asInt(-1));
    }

    /** Uploads a local file to {@code remotePath} inside the sandbox. */
    public void uploadFile(String id, Path localFile, String remotePath) {
        String boundary = "dispense-" + UUID.randomUUID();
        byte[] body;
        try {
            var out = new ByteArrayOutputStream();
            out.write(("--" + boundary + "\r\n"
                    + "Content-Disposition: form-data; name=\"file\"; filename=\"" + localFile.getFileName() + "\"\r\n"
                    + "Content-Type: application/octet-stream\r\n\r\n").getBytes(StandardCharsets.UTF_8));
            out.write(Files.readAllBytes(localFile));
            out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
            body = out.toByteArray();
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED, "Cannot read " + localFile + ": " + e.getMessage(), e);
        }
        var request = baseRequest("/toolbox/" + encode(id) + "/toolbox/files/upload?path=" + encode(remotePath))
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        execute(request, "POST upload " + remotePath);
    }

    JsonNode send(String method, String path, String body) {
        var builder = baseRequest(path).header("Accept", "application/json");
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        String responseBody = execute(builder.build(), method + " " + path);
        if (responseBody == null || responseBody.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE,
                    "Unreadable response from " + method + " " + path + ": " + e.getMessage(), e);
        }
    }

    private HttpRequest.Builder baseRequest(String path) {
        if (!properties.hasApiKey()) {
            throw new DispenseException(ErrorCode.PROVIDER_AUTH_FAILED,
                    "Remote API key not configured. Set DISPENSE_REMOTE_API_KEY.");
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.getApiUrl() + path))
                .timeout(properties.getRequestTimeout())
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("X-Daytona-Source", "dispense");
    }

    private String execute(HttpRequest request, String description) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE,
                    "Remote API request failed: " + description + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE, "Interrupted: " + description, e);
        }
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new DispenseException(ErrorCode.PROVIDER_AUTH_FAILED,
                    "Remote API rejected credentials (HTTP %d) for %s".formatted(status, description));
        }
        if (status == 404) {
            throw new DispenseException(ErrorCode.SANDBOX_NOT_FOUND,
                    "Remote API returned 404 for " + description);
        }
        if (status >= 400) {
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE,
                    "Remote API %s failed (HTTP %d): %s".formatted(description, status, response.body()));
        }
        return response.body();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
