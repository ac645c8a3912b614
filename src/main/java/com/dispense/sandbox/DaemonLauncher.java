package com.dispense.sandbox;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts the daemon jar inside a sandbox and waits, with growing back-off, until its port
 * is listening. Shared by the providers once they have copied the jar in.
 */
public final class DaemonLauncher {

    private static final Logger log = LoggerFactory.getLogger(DaemonLauncher.class);

    private static final long INITIAL_BACKOFF_MS = 250;
    private static final long MAX_BACKOFF_MS = 2000;

    private DaemonLauncher() {}

    public static void launch(SandboxProvider provider, SandboxInfo sandbox, String jarPath, int port, Duration timeout) {
        if (isListening(provider, sandbox, port)) {
            log.info("Daemon already listening on port {} in sandbox {}", port, sandbox.name());
            return;
        }
        ExecResult started = provider.executeCommand(sandbox,
                "nohup java -jar " + jarPath + " daemon > /tmp/dispense-daemon.log 2>&1 &");
        if (!started.succeeded()) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED,
                    "Failed to launch daemon in " + sandbox.name() + ": " + started.stderr());
        }
        awaitListening(provider, sandbox, port, timeout);
    }

    public static boolean isListening(SandboxProvider provider, SandboxInfo sandbox, int port) {
        ExecResult result = provider.executeCommand(sandbox,
                "(ss -ltn 2>/dev/null || netstat -ltn 2>/dev/null) | grep -q ':" + port + " '");
        return result.succeeded();
    }

    private static void awaitListening(SandboxProvider provider, SandboxInfo sandbox, int port, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long backoff = INITIAL_BACKOFF_MS;
        while (System.nanoTime() < deadline) {
            if (isListening(provider, sandbox, port)) {
                log.info("Daemon listening on port {} in sandbox {}", port, sandbox.name());
                return;
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Interrupted while waiting for daemon");
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
        }
        throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE,
                "Daemon in " + sandbox.name() + " did not start listening on port " + port
                        + " within " + timeout.toSeconds() + "s");
    }
}
