package com.dispense.core.health;

import com.dispense.daemon.DaemonProperties;
import com.dispense.daemon.TaskSupervisor;
import com.dispense.sandbox.remote.RemoteProperties;
import com.github.dockerjava.api.DockerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component checks for both roles. In the daemon (a {@link TaskSupervisor} is present) it
 * reports the supervisor, the log directory and the agent binary; in the controller it
 * reports the sandbox providers.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DaemonProperties daemonProperties;
    private final TaskSupervisor taskSupervisor;
    private final DockerClient dockerClient;
    private final RemoteProperties remoteProperties;

    public HealthCheckService(
            DaemonProperties daemonProperties,
            @Autowired(required = false) TaskSupervisor taskSupervisor,
            @Autowired(required = false) DockerClient dockerClient,
            @Autowired(required = false) RemoteProperties remoteProperties) {
        this.daemonProperties = daemonProperties;
        this.taskSupervisor = taskSupervisor;
        this.dockerClient = dockerClient;
        this.remoteProperties = remoteProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        if (taskSupervisor != null) {
            results.add(checkSupervisor());
            results.add(checkLogDirectory());
            results.add(checkAgentExecutable());
        } else {
            results.add(checkDocker());
            results.add(checkRemote());
        }
        return results;
    }

    private HealthStatus checkSupervisor() {
        return new HealthStatus("supervisor", HealthStatus.Status.UP, "Accepting tasks",
                Map.of("active_tasks", String.valueOf(taskSupervisor.activeTaskCount()),
                        "total_tasks", String.valueOf(taskSupervisor.taskCount())));
    }

    private HealthStatus checkLogDirectory() {
        Path dir = daemonProperties.logDirectory();
        if (Files.isDirectory(dir) && Files.isWritable(dir)) {
            return HealthStatus.up("log-directory", dir + " is writable");
        }
        return HealthStatus.down("log-directory", dir + " is missing or not writable");
    }

    HealthStatus checkAgentExecutable() {
        String executable = daemonProperties.getAgent().getExecutable();
        Path resolved = resolveExecutable(executable, System.getenv("PATH"));
        if (resolved != null) {
            return new HealthStatus("agent", HealthStatus.Status.UP, "Agent executable found",
                    Map.of("path", resolved.toString()));
        }
        return new HealthStatus("agent", HealthStatus.Status.DEGRADED,
                executable + " not found on PATH; tasks will fail to start", Map.of());
    }

    static Path resolveExecutable(String executable, String pathVariable) {
        if (executable.contains(File.separator)) {
            Path path = Path.of(executable);
            return Files.isExecutable(path) ? path : null;
        }
        if (pathVariable == null) {
            return null;
        }
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private HealthStatus checkDocker() {
        if (dockerClient == null) {
            return HealthStatus.down("docker", "No Docker client configured");
        }
        try {
            dockerClient.pingCmd().exec();
            return HealthStatus.up("docker", "Docker daemon reachable");
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DEGRADED,
                    "Docker unavailable, local sandboxes disabled: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkRemote() {
        if (remoteProperties == null || !remoteProperties.hasApiKey()) {
            return new HealthStatus("remote", HealthStatus.Status.DEGRADED,
                    "No remote API key configured, remote sandboxes disabled", Map.of());
        }
        return new HealthStatus("remote", HealthStatus.Status.UP, "Remote API key configured",
                Map.of("api_url", remoteProperties.getApiUrl()));
    }
}
