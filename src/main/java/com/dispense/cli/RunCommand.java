package com.dispense.cli;

import com.dispense.client.FrameStream;
import com.dispense.core.error.DispenseException;
import com.dispense.follow.FollowOutcome;
import com.dispense.follow.LogFollower;
import com.dispense.follow.RenderMode;
import com.dispense.follow.SandboxLogSource;
import com.dispense.protocol.CreateTaskResponse;
import com.dispense.protocol.ExecuteRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: dispense run &lt;sandbox&gt; "&lt;prompt&gt;"
 * <p>
 * Starts an agent task in the sandbox's daemon and streams its output until the task
 * finishes. With {@code --detach} the task is only started.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an agent task in a sandbox")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sandbox name or id")
    private String sandbox;

    @Parameters(index = "1", description = "Prompt for the agent")
    private String prompt;

    @Option(names = {"--model", "-m"}, description = "Model to use")
    private String model;

    @Option(names = {"--workdir", "-w"}, description = "Working directory inside the sandbox")
    private String workDir;

    @Option(names = {"--api-key"}, description = "Anthropic API key (default: dispense.controller.anthropic-api-key)")
    private String apiKey;

    @Option(names = {"--env", "-e"}, description = "Extra environment variable for the agent (KEY=VALUE)")
    private Map<String, String> environment;

    @Option(names = {"--detach", "-d"}, description = "Start the task and return immediately")
    private boolean detach;

    @Option(names = {"--output", "-o"}, description = "Output mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "FOLLOW")
    private RenderMode output;

    private final DaemonConnector connector;

    public RunCommand(DaemonConnector connector) {
        this.connector = connector;
    }

    @Override
    public Integer call() {
        try (DaemonSession session = connector.open(sandbox)) {
            String dir = workDir != null ? workDir : connector.workDir(session.sandbox());
            ExecuteRequest request = new ExecuteRequest(prompt, dir, resolveApiKey(), model, environment);

            if (detach) {
                CreateTaskResponse response = session.client().createTask(request);
                ConsoleOutput.success("Task " + response.taskId() + " started in " + session.sandbox().name());
                ConsoleOutput.info("Follow it with: dispense logs " + sandbox + " --task " + response.taskId());
                return 0;
            }

            ConsoleOutput.sandbox("Running in " + session.sandbox().name() + " (" + dir + ")");
            FollowOutcome outcome;
            try (FollowConsole console = new FollowConsole(output, connector.objectMapper());
                 FrameStream frames = session.client().openExecution(request)) {
                String taskId = frames.taskId();
                if (taskId != null) {
                    ConsoleOutput.info("Task " + taskId + " (stop it with: dispense stop " + sandbox + " " + taskId + ")");
                }
                LogFollower follower = console.follower(
                        new SandboxLogSource(connector.provider(session.sandbox()), session.sandbox()),
                        () -> session.statusClient().getTaskStatus(taskId),
                        connector.properties());
                outcome = follower.followStream(frames);
            }
            ConsoleOutput.outcome(outcome);
            return outcome.isSuccess() ? 0 : 1;
        } catch (DispenseException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private String resolveApiKey() {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        return connector.properties().getAnthropicApiKey();
    }
}
