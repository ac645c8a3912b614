package com.dispense.cli;

import com.dispense.core.error.DispenseException;
import com.dispense.protocol.TaskInfo;
import com.dispense.protocol.TaskState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: dispense tasks &lt;sandbox&gt; [--state RUNNING]
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List tasks, newest first")
@Component
public class TasksCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox name or id")
    private String sandbox;

    @Option(names = {"--state", "-s"}, description = "Only tasks in this state: ${COMPLETION-CANDIDATES}")
    private TaskState state;

    private final DaemonConnector connector;

    public TasksCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        try (DaemonSession session = connector.open(sandbox)) {
            List<TaskInfo> tasks = session.client().listTasks(state);
            if (tasks.isEmpty()) {
                ConsoleOutput.info("No tasks" + (state != null ? " in state " + state : "")
                        + " in " + session.sandbox().name());
                return 0;
            }
            System.out.printf("  %-28s %-10s %-20s %-5s %s%n", "TASK", "STATE", "STARTED", "EXIT", "PROMPT");
            System.out.println("  " + "-".repeat(96));
            for (TaskInfo task : tasks) {
                System.out.printf("  %-28s %-10s %-20s %-5s %s%n",
                        task.taskId(), task.state(), ConsoleOutput.formatTime(task.startedAt()),
                        task.exitCode() != null ? task.exitCode() : "-",
                        ConsoleOutput.truncate(task.prompt(), 30));
            }
            return 0;
        } catch (DispenseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
