package com.dispense.daemon;

import com.dispense.core.events.EventBus;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.protocol.ExecuteRequest;
import com.dispense.protocol.TaskState;
import com.dispense.protocol.TaskStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Builds supervisors whose "agent" is {@code /bin/sh -c <prompt>}, so a prompt is a shell script.
 */
public final class DaemonTestSupport {

    private DaemonTestSupport() {
    }

    public static DaemonProperties shellProperties(Path logDir) {
        DaemonProperties properties = new DaemonProperties();
        properties.setLogDir(logDir.resolve("logs").toString());
        properties.setDefaultWorkingDirectory(logDir.toString());
        properties.setStopGrace(Duration.ofSeconds(2));
        properties.setTailInterval(Duration.ofMillis(20));
        properties.setStreamWait(Duration.ofSeconds(2));
        properties.getAgent().setExecutable("/bin/sh");
        properties.getAgent().setArguments(List.of("-c"));
        properties.getAgent().setSetupCommands(List.of());
        return properties;
    }

    public static TaskSupervisor supervisor(DaemonProperties properties, EventBus eventBus, DispenseMetrics metrics) {
        return new TaskSupervisor(new TaskRegistry(), new TaskIdGenerator(),
                new AgentInvocation(properties.getAgent()), new AgentConfigurer(properties.getAgent()),
                properties, eventBus, metrics);
    }

    public static ExecuteRequest script(String script) {
        return new ExecuteRequest(script, null, null, null, Map.of());
    }

    public static TaskStatus awaitState(TaskSupervisor supervisor, String taskId, TaskState state, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            TaskStatus status = supervisor.getStatus(taskId);
            if (status.state() == state) {
                return status;
            }
            Thread.sleep(10);
        }
        fail("Task " + taskId + " did not reach " + state + ", last: " + supervisor.getStatus(taskId).state());
        return null;
    }

    public static TaskStatus awaitDone(TaskSupervisor supervisor, String taskId) throws InterruptedException {
        if (!supervisor.awaitFinalized(taskId, Duration.ofSeconds(20))) {
            fail("Task " + taskId + " was not finalized in time");
        }
        return supervisor.getStatus(taskId);
    }
}
