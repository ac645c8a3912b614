package com.dispense.cli;

import com.dispense.core.error.DispenseException;
import com.dispense.protocol.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dispense stop &lt;sandbox&gt; &lt;task-id&gt;
 * <p>
 * Stops a running task. With {@code --remove} the stopped task is also dropped from the
 * daemon's task list.
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a running task")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox name or id")
    private String sandbox;

    @Parameters(index = "1", description = "Task id")
    private String taskId;

    @Option(names = {"--remove"}, description = "Remove the task from the daemon after stopping it")
    private boolean remove;

    private final DaemonConnector connector;

    public StopCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        try (DaemonSession session = connector.open(sandbox)) {
            TaskStatus status = session.client().stopTask(taskId);
            ConsoleOutput.state(status.state(), taskId + ": " + (status.error() != null ? status.error() : status.message()));
            if (remove) {
                session.client().cleanupTask(taskId);
                ConsoleOutput.success("Removed " + taskId);
            }
            return 0;
        } catch (DispenseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
