package com.dispense.cli;

import com.dispense.core.error.DispenseException;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;
import com.dispense.sandbox.SandboxInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: dispense wait [sandbox...] [--group &lt;name&gt;...]
 * <p>
 * Polls the latest task of every selected sandbox until none is pending or running.
 * A sandbox whose daemon cannot answer counts as done, as does one with no tasks.
 */
@Command(name = "wait", mixinStandardHelpOptions = true,
        description = "Wait until the latest task in each sandbox has finished")
@Component
public class WaitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WaitCommand.class);

    @Parameters(arity = "0..*", description = "Sandbox names or ids")
    private List<String> sandboxes = new ArrayList<>();

    @Option(names = {"--group", "-g"}, description = "Also wait for every sandbox in this group (repeatable)")
    private List<String> groups = new ArrayList<>();

    private final DaemonConnector connector;

    public WaitCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        if (sandboxes.isEmpty() && groups.isEmpty()) {
            ConsoleOutput.error("Specify at least one sandbox or --group");
            return 2;
        }

        List<SandboxInfo> targets;
        try {
            targets = resolveTargets();
        } catch (DispenseException e) {
            ConsoleOutput.error("Cannot resolve sandboxes: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Waiting for " + targets.size() + " sandbox(es):");
        for (SandboxInfo sandbox : targets) {
            System.out.println("  - " + sandbox.name() + " (" + sandbox.type() + ")");
        }

        Map<String, Observation> latest = new HashMap<>();
        while (true) {
            boolean working = false;
            for (int i = 0; i < targets.size(); i++) {
                SandboxInfo sandbox = targets.get(i);
                Observation observation = observe(sandbox);
                if (!observation.equals(latest.put(sandbox.id(), observation))) {
                    System.out.printf("  [%d/%d] %s: %s%n", i + 1, targets.size(), sandbox.name(), observation.label());
                }
                working |= observation.working();
            }
            if (!working) {
                break;
            }
            try {
                Thread.sleep(connector.properties().getWaitInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ConsoleOutput.info("Stopped waiting");
                return 1;
            }
        }

        long failed = latest.values().stream().filter(o -> o.state() == TaskState.FAILED).count();
        if (failed > 0) {
            ConsoleOutput.warn("All sandboxes have finished; " + failed + " latest task(s) failed");
            return 1;
        }
        ConsoleOutput.success("All sandboxes have finished their tasks");
        return 0;
    }

    /** Named sandboxes first, then group members, each sandbox once. */
    private List<SandboxInfo> resolveTargets() {
        Map<String, SandboxInfo> targets = new LinkedHashMap<>();
        for (String name : sandboxes) {
            SandboxInfo sandbox = connector.lookup(name);
            targets.putIfAbsent(sandbox.id(), sandbox);
        }
        for (String group : groups) {
            for (SandboxInfo sandbox : connector.lookupGroup(group)) {
                targets.putIfAbsent(sandbox.id(), sandbox);
            }
        }
        return new ArrayList<>(targets.values());
    }

    private Observation observe(SandboxInfo sandbox) {
        try (DaemonSession session = connector.open(sandbox)) {
            TaskStatus status = session.statusClient().getTaskStatus(null);
            if (status.isIdle()) {
                return new Observation(null, "Idle");
            }
            return new Observation(status.state(), label(status.state()) + " (" + status.taskId() + ")");
        } catch (DispenseException e) {
            log.debug("Status of {} unavailable, treating as done: {}", sandbox.name(), e.getMessage());
            return new Observation(null, "No status (" + e.getMessage() + ")");
        }
    }

    private static String label(TaskState state) {
        return switch (state) {
            case PENDING -> "Pending";
            case RUNNING -> "Working";
            case COMPLETED -> "Completed";
            case FAILED -> "Failed";
        };
    }

    private record Observation(TaskState state, String label) {

        boolean working() {
            return state == TaskState.PENDING || state == TaskState.RUNNING;
        }
    }
}
