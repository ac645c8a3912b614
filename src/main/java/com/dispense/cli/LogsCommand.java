package com.dispense.cli;

import com.dispense.client.FrameStream;
import com.dispense.core.error.DispenseException;
import com.dispense.follow.FollowOutcome;
import com.dispense.follow.LogFollower;
import com.dispense.follow.LogSource;
import com.dispense.follow.RenderMode;
import com.dispense.follow.SandboxLogSource;
import com.dispense.protocol.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: dispense logs &lt;sandbox&gt; [--task &lt;id&gt;]
 * <p>
 * Follows a task until it finishes. Attaches to the daemon's stream by default; with
 * {@code --poll}, or when the daemon no longer knows the task, re-reads the task log file
 * in the sandbox.
 */
@Command(name = "logs", mixinStandardHelpOptions = true, description = "Follow the output of a task")
@Component
public class LogsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox name or id")
    private String sandbox;

    @Option(names = {"--task", "-t"}, description = "Task id (default: latest task)")
    private String taskId;

    @Option(names = {"--poll"}, description = "Poll the log file instead of attaching to the stream")
    private boolean poll;

    @Option(names = {"--output", "-o"}, description = "Output mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "FOLLOW")
    private RenderMode output;

    private final DaemonConnector connector;

    public LogsCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        try (DaemonSession session = connector.open(sandbox)) {
            LogSource source = new SandboxLogSource(connector.provider(session.sandbox()), session.sandbox());
            String logDir = connector.properties().logDirFor(session.sandbox().type());

            Optional<String> resolved = resolveTask(session, source, logDir);
            if (resolved.isEmpty()) {
                ConsoleOutput.info("No tasks found in " + session.sandbox().name());
                return 0;
            }
            String task = resolved.get();
            ConsoleOutput.info("Following task " + task + " in " + session.sandbox().name());

            FollowOutcome outcome = null;
            try (FollowConsole console = new FollowConsole(output, connector.objectMapper())) {
                LogFollower follower = console.follower(source,
                        () -> session.statusClient().getTaskStatus(task), connector.properties());
                if (!poll) {
                    try (FrameStream frames = session.client().openStream(task)) {
                        outcome = follower.followStream(frames);
                    } catch (DispenseException e) {
                        if (!e.isNotFound()) {
                            throw e;
                        }
                        ConsoleOutput.warn("Daemon has no stream for " + task + ", reading the log file");
                    }
                }
                if (outcome == null) {
                    outcome = follower.followFile(logDir + "/" + task + ".log");
                }
            }
            ConsoleOutput.outcome(outcome);
            return outcome.isSuccess() ? 0 : 1;
        } catch (DispenseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private Optional<String> resolveTask(DaemonSession session, LogSource source, String logDir) {
        if (taskId != null && !taskId.isBlank()) {
            return Optional.of(taskId);
        }
        TaskStatus latest = session.client().getTaskStatus(null);
        if (!latest.isIdle()) {
            return Optional.of(latest.taskId());
        }
        return source.latestLog(logDir).map(LogsCommand::taskIdOf);
    }

    static String taskIdOf(String logPath) {
        String name = logPath.substring(logPath.lastIndexOf('/') + 1);
        return name.endsWith(".log") ? name.substring(0, name.length() - 4) : name;
    }
}
