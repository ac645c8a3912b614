package com.dispense.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the agent's one-time setup commands (onboarding, trust dialog, allowed tools)
 * before the first task. Failures are warnings; a task never fails because of them.
 * Each command is bounded by the setup timeout and killed when it runs over.
 */
public class AgentConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AgentConfigurer.class);

    private final DaemonProperties.Agent agent;
    private boolean configured;

    public AgentConfigurer(DaemonProperties.Agent agent) {
        this.agent = agent;
    }

    public synchronized void ensureConfigured() {
        if (configured) {
            return;
        }
        configured = true;
        for (String commandLine : agent.getSetupCommands()) {
            List<String> command = Arrays.stream(commandLine.trim().split("\\s+"))
                    .filter(s -> !s.isEmpty())
                    .toList();
            if (!command.isEmpty()) {
                run(command);
            }
        }
    }

    private void run(List<String> command) {
        String display = String.join(" ", command);
        Path output = null;
        try {
            output = Files.createTempFile("dispense-setup", ".log");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            process.getOutputStream().close();
            if (!process.waitFor(agent.getSetupTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Agent setup command timed out after {}: {}", agent.getSetupTimeout(), display);
                return;
            }
            if (process.exitValue() != 0) {
                String text = Files.readString(output, StandardCharsets.UTF_8).trim();
                log.warn("Agent setup command failed ({}): {} {}", process.exitValue(), display, text);
            } else {
                log.debug("Agent setup command succeeded: {}", display);
            }
        } catch (IOException e) {
            log.warn("Agent setup command could not run: {} ({})", display, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Agent setup interrupted");
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
