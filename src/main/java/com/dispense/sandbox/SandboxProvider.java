package com.dispense.sandbox;

import com.dispense.tunnel.DaemonEndpoint;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over where sandboxes live.
 * Implementations: {@link DockerSandboxProvider} (local), {@code RemoteSandboxProvider} (hosted).
 * <p>
 * Failures surface as {@link com.dispense.core.error.DispenseException}.
 */
public interface SandboxProvider {

    SandboxType type();

    SandboxInfo create(CreateOptions options);

    List<SandboxInfo> list();

    default Optional<SandboxInfo> find(String nameOrId) {
        return list().stream().filter(s -> s.matches(nameOrId)).findFirst();
    }

    void delete(String id);

    /** Runs a shell command inside the sandbox and waits for it. */
    ExecResult executeCommand(SandboxInfo sandbox, String command);

    /** Directory tasks run in by default. */
    String getWorkDir(SandboxInfo sandbox);

    /** Copies the daemon jar into the sandbox, launches it, and waits for its port. */
    void installSupervisor(SandboxInfo sandbox, Path daemonJar);

    /**
     * Returns an endpoint for the sandbox's daemon. The caller must close it; for sandboxes
     * behind a tunnel that tears the tunnel down.
     */
    DaemonEndpoint getConnection(SandboxInfo sandbox);
}
