package com.dispense.sandbox;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.tunnel.DaemonEndpoint;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.NetworkSettings;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based {@link SandboxProvider} for sandboxes on this machine.
 *
 * <p>Sandboxes are containers labelled {@code dispense.sandbox=true}, named through the
 * {@code dispense.name} label. The daemon inside listens on the container's bridge IP,
 * so connections need no tunnel.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String LABEL_SANDBOX = "dispense.sandbox";
    static final String LABEL_NAME = "dispense.name";
    static final String LABEL_TYPE = "dispense.type";
    static final String LABEL_GROUP = "dispense.group";

    private static final long EXEC_TIMEOUT_MINUTES = 10;

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    public DockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public SandboxType type() {
        return SandboxType.LOCAL;
    }

    @Override
    public SandboxInfo create(CreateOptions options) {
        String image = options.image() != null ? options.image() : properties.getImage();
        String containerName = "dispense-" + options.name();
        try {
            ensureImage(image);

            var labels = new HashMap<String, String>();
            labels.put(LABEL_SANDBOX, "true");
            labels.put(LABEL_NAME, options.name());
            labels.put(LABEL_TYPE, "local");
            if (options.group() != null) {
                labels.put(LABEL_GROUP, options.group());
            }

            var envList = new ArrayList<String>();
            options.environment().forEach((k, v) -> envList.add(k + "=" + v));

            int cpus = options.cpu() != null ? options.cpu() : properties.getCpuCount();
            long memoryBytes = options.memoryGb() != null
                    ? options.memoryGb() * 1024L * 1024 * 1024
                    : properties.getMemoryLimitMb() * 1024L * 1024;
            var hostConfig = HostConfig.newHostConfig()
                    .withMemory(memoryBytes)
                    .withCpuCount((long) cpus);

            log.info("Creating local sandbox {} (image: {})", options.name(), image);
            var response = dockerClient.createContainerCmd(image)
                    .withName(containerName)
                    .withLabels(labels)
                    .withEnv(envList)
                    .withHostConfig(hostConfig)
                    .withWorkingDir(properties.getWorkDir())
                    .withTty(true)
                    .withStdinOpen(true)
                    .exec();

            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Sandbox {} started (container {})", options.name(), containerId);
            return new SandboxInfo(containerId, options.name(), SandboxType.LOCAL, "running",
                    Map.of("container_id", containerId, "container_name", containerName, "image", image));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE, "Interrupted while pulling " + image, e);
        } catch (RuntimeException e) {
            throw unavailable("create sandbox " + options.name(), e);
        }
    }

    @Override
    public List<SandboxInfo> list() {
        try {
            List<Container> containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(Map.of(LABEL_SANDBOX, "true"))
                    .exec();
            return containers.stream().map(this::toInfo).toList();
        } catch (RuntimeException e) {
            throw unavailable("list sandboxes", e);
        }
    }

    @Override
    public void delete(String id) {
        SandboxInfo sandbox = find(id).orElseThrow(() -> DispenseException.sandboxNotFound(id));
        try {
            dockerClient.stopContainerCmd(sandbox.id()).exec();
        } catch (RuntimeException e) {
            log.debug("Container {} may already be stopped: {}", sandbox.id(), e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(sandbox.id()).withForce(true).exec();
            log.info("Sandbox {} removed", sandbox.name());
        } catch (NotFoundException e) {
            throw DispenseException.sandboxNotFound(id);
        } catch (RuntimeException e) {
            throw unavailable("remove sandbox " + sandbox.name(), e);
        }
    }

    @Override
    public ExecResult executeCommand(SandboxInfo sandbox, String command) {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        try {
            String execId = dockerClient.execCreateCmd(sandbox.id())
                    .withCmd("/bin/sh", "-c", command)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec()
                    .getId();
            boolean finished = dockerClient.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            String payload = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(payload);
                            } else {
                                stdout.append(payload);
                            }
                        }
                    })
                    .awaitCompletion(EXEC_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!finished) {
                throw new DispenseException(ErrorCode.COMMAND_FAILED,
                        "Command timed out in " + sandbox.name() + ": " + command);
            }
            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ExecResult(stdout.toString(), stderr.toString(), exitCode == null ? -1 : exitCode.intValue());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispenseException(ErrorCode.COMMAND_FAILED, "Interrupted running command in " + sandbox.name(), e);
        } catch (NotFoundException e) {
            throw DispenseException.sandboxNotFound(sandbox.name());
        } catch (DispenseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw unavailable("execute command in " + sandbox.name(), e);
        }
    }

    @Override
    public String getWorkDir(SandboxInfo sandbox) {
        return properties.getWorkDir();
    }

    @Override
    public void installSupervisor(SandboxInfo sandbox, Path daemonJar) {
        String installDir = properties.getDaemonInstallDir();
        ExecResult mkdir = executeCommand(sandbox, "mkdir -p " + installDir);
        if (!mkdir.succeeded()) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED, "Cannot create " + installDir + ": " + mkdir.stderr());
        }
        try {
            dockerClient.copyArchiveToContainerCmd(sandbox.id())
                    .withHostResource(daemonJar.toString())
                    .withRemotePath(installDir)
                    .exec();
        } catch (RuntimeException e) {
            throw unavailable("copy daemon into " + sandbox.name(), e);
        }
        String jarPath = installDir + "/" + daemonJar.getFileName();
        DaemonLauncher.launch(this, sandbox, jarPath, properties.getDaemonPort(), properties.getDaemonStartTimeout());
    }

    @Override
    public DaemonEndpoint getConnection(SandboxInfo sandbox) {
        InspectContainerResponse container;
        try {
            container = dockerClient.inspectContainerCmd(sandbox.id()).exec();
        } catch (NotFoundException e) {
            throw DispenseException.sandboxNotFound(sandbox.name());
        } catch (RuntimeException e) {
            throw unavailable("inspect sandbox " + sandbox.name(), e);
        }
        String ip = containerIp(container.getNetworkSettings());
        if (ip == null) {
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE,
                    "Sandbox " + sandbox.name() + " has no IP address (is it running?)");
        }
        return DaemonEndpoint.direct(ip, properties.getDaemonPort());
    }

    @SuppressWarnings("deprecation")
    private static String containerIp(NetworkSettings settings) {
        if (settings == null) {
            return null;
        }
        if (settings.getNetworks() != null) {
            for (ContainerNetwork network : settings.getNetworks().values()) {
                if (network.getIpAddress() != null && !network.getIpAddress().isBlank()) {
                    return network.getIpAddress();
                }
            }
        }
        String ip = settings.getIpAddress();
        return ip == null || ip.isBlank() ? null : ip;
    }

    private void ensureImage(String image) throws InterruptedException {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            log.info("Image {} not found locally, pulling", image);
            dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(EXEC_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        }
    }

    private SandboxInfo toInfo(Container container) {
        Map<String, String> labels = container.getLabels() != null ? container.getLabels() : Map.of();
        String containerName = container.getNames() != null && container.getNames().length > 0
                ? container.getNames()[0].replaceFirst("^/", "")
                : container.getId();
        String name = labels.getOrDefault(LABEL_NAME, containerName);
        var metadata = new HashMap<String, String>();
        metadata.put("container_id", container.getId());
        metadata.put("container_name", containerName);
        if (container.getImage() != null) {
            metadata.put("image", container.getImage());
        }
        if (labels.containsKey(LABEL_GROUP)) {
            metadata.put("group", labels.get(LABEL_GROUP));
        }
        return new SandboxInfo(container.getId(), name, SandboxType.LOCAL, container.getState(), metadata);
    }

    private static DispenseException unavailable(String action, RuntimeException e) {
        return new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE,
                "Docker failed to " + action + ": " + e.getMessage(), e);
    }
}
