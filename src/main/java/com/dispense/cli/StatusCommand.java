package com.dispense.cli;

import com.dispense.core.error.DispenseException;
import com.dispense.protocol.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dispense status &lt;sandbox&gt; [--task &lt;id&gt;]
 * <p>
 * Shows the status of one task, or of the most recent task in the sandbox.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox name or id")
    private String sandbox;

    @Option(names = {"--task", "-t"}, description = "Task id (default: latest task)")
    private String taskId;

    private final DaemonConnector connector;

    public StatusCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        try (DaemonSession session = connector.open(sandbox)) {
            TaskStatus status = session.statusClient().getTaskStatus(taskId);
            if (status.isIdle()) {
                ConsoleOutput.info(status.message());
                return 0;
            }
            print(status);
            return 0;
        } catch (DispenseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    static void print(TaskStatus status) {
        System.out.println();
        System.out.println("TASK " + status.taskId());
        ConsoleOutput.state(status.state(), status.message());
        System.out.println("  Prompt:    " + ConsoleOutput.truncate(status.prompt(), 70));
        System.out.println("  Directory: " + (status.workingDirectory() != null ? status.workingDirectory() : "-"));
        System.out.println("  Started:   " + ConsoleOutput.formatTime(status.startedAt()));
        if (status.finishedAt() != null) {
            System.out.println("  Finished:  " + ConsoleOutput.formatTime(status.finishedAt())
                    + " (" + ConsoleOutput.formatDuration(status.finishedAt() - status.startedAt()) + ")");
        }
        if (status.exitCode() != null) {
            System.out.println("  Exit code: " + status.exitCode());
        }
        if (status.error() != null && !status.error().isBlank()) {
            ConsoleOutput.error("Error: " + status.error());
        }
    }
}
