package com.dispense.sandbox.remote;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.sandbox.CreateOptions;
import com.dispense.sandbox.DaemonLauncher;
import com.dispense.sandbox.ExecResult;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.sandbox.SandboxProvider;
import com.dispense.sandbox.SandboxProperties;
import com.dispense.sandbox.SandboxType;
import com.dispense.tunnel.DaemonEndpoint;
import com.dispense.tunnel.SshTunnelFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link com.dispense.sandbox.SandboxProvider} backed by the hosted control plane.
 *
 * <p>The daemon in a remote sandbox is not directly reachable. {@link #getConnection} asks
 * the control plane for a short-lived SSH token and opens a local port forward through the
 * relay to the daemon port inside the sandbox.
 */
public class RemoteSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(RemoteSandboxProvider.class);

    static final String LABEL_SANDBOX = "dispense.sandbox";
    static final String LABEL_NAME = "dispense.name";
    static final String LABEL_GROUP = "dispense.group";

    private static final String STATE_STARTED = "started";
    private static final long POLL_INTERVAL_MS = 2000;

    private final RemoteApiClient api;
    private final RemoteProperties properties;
    private final SandboxProperties sandboxProperties;
    private final SshTunnelFactory tunnelFactory;
    private final ObjectMapper objectMapper;

    public RemoteSandboxProvider(RemoteApiClient api,
                                 RemoteProperties properties,
                                 SandboxProperties sandboxProperties,
                                 SshTunnelFactory tunnelFactory,
                                 ObjectMapper objectMapper) {
        this.api = api;
        this.properties = properties;
        this.sandboxProperties = sandboxProperties;
        this.tunnelFactory = tunnelFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public SandboxType type() {
        return SandboxType.REMOTE;
    }

    @Override
    public SandboxInfo create(CreateOptions options) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode labels = body.putObject("labels");
        labels.put(LABEL_SANDBOX, "true");
        labels.put(LABEL_NAME, options.name());
        if (options.group() != null) {
            labels.put(LABEL_GROUP, options.group());
        }
        String snapshot = options.image() != null ? options.image() : properties.getSnapshot();
        if (snapshot != null && !snapshot.isBlank()) {
            body.put("snapshot", snapshot);
        }
        if (properties.getTarget() != null && !properties.getTarget().isBlank()) {
            body.put("target", properties.getTarget());
        }
        if (options.cpu() != null) {
            body.put("cpu", options.cpu());
        }
        if (options.memoryGb() != null) {
            body.put("memory", options.memoryGb());
        }
        if (options.diskGb() != null) {
            body.put("disk", options.diskGb());
        }
        if (options.autoStopMinutes() != null) {
            body.put("autoStopInterval", options.autoStopMinutes());
        }
        if (!options.environment().isEmpty()) {
            ObjectNode env = body.putObject("env");
            options.environment().forEach(env::put);
        }

        JsonNode created = api.createSandbox(body);
        SandboxInfo sandbox = toInfo(created);
        return awaitStarted(sandbox);
    }

    @Override
    public List<SandboxInfo> list() {
        return api.listSandboxes().stream()
                .filter(node -> "true".equals(node.path("labels").path(LABEL_SANDBOX).asText()))
                .map(this::toInfo)
                .toList();
    }

    @Override
    public Optional<SandboxInfo> find(String nameOrId) {
        Optional<SandboxInfo> byLabel = list().stream().filter(s -> s.matches(nameOrId)).findFirst();
        if (byLabel.isPresent()) {
            return byLabel;
        }
        try {
            return Optional.of(toInfo(api.getSandbox(nameOrId)));
        } catch (DispenseException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void delete(String id) {
        SandboxInfo sandbox = find(id).orElseThrow(() -> DispenseException.sandboxNotFound(id));
        api.deleteSandbox(sandbox.id());
    }

    @Override
    public ExecResult executeCommand(SandboxInfo sandbox, String command) {
        return api.executeCommand(sandbox.id(), command, null);
    }

    @Override
    public String getWorkDir(SandboxInfo sandbox) {
        ExecResult home = executeCommand(sandbox, "pwd");
        String dir = home.stdout().trim();
        if (!home.succeeded() || dir.isEmpty()) {
            log.warn("Could not resolve home of sandbox {}, using {}", sandbox.name(), sandboxProperties.getWorkDir());
            return sandboxProperties.getWorkDir();
        }
        return dir + "/workspace";
    }

    @Override
    public void installSupervisor(SandboxInfo sandbox, Path daemonJar) {
        String installDir = properties.getDaemonInstallDir();
        ExecResult mkdir = executeCommand(sandbox, "mkdir -p " + installDir);
        if (!mkdir.succeeded()) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED, "Cannot create " + installDir + ": " + mkdir.stdout());
        }
        String jarPath = installDir + "/" + daemonJar.getFileName();
        api.uploadFile(sandbox.id(), daemonJar, jarPath);
        log.info("Uploaded daemon to {}:{}", sandbox.name(), jarPath);
        DaemonLauncher.launch(this, sandbox, jarPath, sandboxProperties.getDaemonPort(),
                sandboxProperties.getDaemonStartTimeout());
    }

    @Override
    public DaemonEndpoint getConnection(SandboxInfo sandbox) {
        SandboxInfo running = STATE_STARTED.equals(sandbox.state()) ? sandbox : ensureStarted(sandbox);
        SshAccess access = api.createSshAccess(running.id(), properties.getSshAccessMinutes());
        log.debug("Obtained SSH access for sandbox {} (expires {})", running.name(), access.expiresAt());
        return tunnelFactory.open(access.token(), "localhost", sandboxProperties.getDaemonPort());
    }

    private SandboxInfo ensureStarted(SandboxInfo sandbox) {
        String state = sandbox.state() == null ? "" : sandbox.state().toLowerCase(Locale.ROOT);
        if (state.equals("stopped") || state.equals("archived")) {
            log.info("Starting remote sandbox {} (state={})", sandbox.name(), state);
            api.startSandbox(sandbox.id());
        }
        return awaitStarted(sandbox);
    }

    private SandboxInfo awaitStarted(SandboxInfo sandbox) {
        long deadline = System.nanoTime() + properties.getStartTimeout().toNanos();
        SandboxInfo current = sandbox;
        while (!STATE_STARTED.equals(current.state())) {
            if ("error".equals(current.state()) || System.nanoTime() > deadline) {
                throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE,
                        "Sandbox " + sandbox.name() + " did not start (state=" + current.state() + ")");
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE, "Interrupted while starting " + sandbox.name(), e);
            }
            current = toInfo(api.getSandbox(sandbox.id()));
        }
        return current;
    }

    private SandboxInfo toInfo(JsonNode node) {
        String id = node.path("id").asText();
        JsonNode labels = node.path("labels");
        String name = labels.path(LABEL_NAME).asText(id);
        var metadata = new HashMap<String, String>();
        if (labels.has(LABEL_GROUP)) {
            metadata.put("group", labels.path(LABEL_GROUP).asText());
        }
        if (node.hasNonNull("target")) {
            metadata.put("target", node.path("target").asText());
        }
        if (node.hasNonNull("snapshot")) {
            metadata.put("snapshot", node.path("snapshot").asText());
        }
        return new SandboxInfo(id, name, SandboxType.REMOTE,
                node.path("state").asText("unknown").toLowerCase(Locale.ROOT), Map.copyOf(metadata));
    }
}
