package com.dispense.daemon;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "dispense.daemon")
public class DaemonProperties {

    public static final int DEFAULT_PORT = 28080;

    private int port = DEFAULT_PORT;
    private String logDir = Path.of(System.getProperty("user.home"), ".dispense", "logs").toString();
    private String defaultWorkingDirectory = "/workspace";
    private Duration stopGrace = Duration.ofSeconds(5);
    /** How long a new stream waits for a task's log file to appear. */
    private Duration streamWait = Duration.ofSeconds(5);
    private Duration tailInterval = Duration.ofMillis(100);
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private Agent agent = new Agent();

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getLogDir() { return logDir; }
    public void setLogDir(String logDir) { this.logDir = logDir; }
    public String getDefaultWorkingDirectory() { return defaultWorkingDirectory; }
    public void setDefaultWorkingDirectory(String defaultWorkingDirectory) { this.defaultWorkingDirectory = defaultWorkingDirectory; }
    public Duration getStopGrace() { return stopGrace; }
    public void setStopGrace(Duration stopGrace) { this.stopGrace = stopGrace; }
    public Duration getStreamWait() { return streamWait; }
    public void setStreamWait(Duration streamWait) { this.streamWait = streamWait; }
    public Duration getTailInterval() { return tailInterval; }
    public void setTailInterval(Duration tailInterval) { this.tailInterval = tailInterval; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }

    public Path logDirectory() {
        return Path.of(logDir);
    }

    /**
     * How the agent binary is invoked. The prompt is always appended as the last argument.
     */
    public static class Agent {
        private String executable = "claude";
        private List<String> arguments = new ArrayList<>(List.of(
                "--dangerously-skip-permissions",
                "--print",
                "--output-format=stream-json",
                "--include-partial-messages",
                "--verbose"));
        /** Commands run once per daemon before the first task; each entry is split on whitespace. */
        private List<String> setupCommands = new ArrayList<>(List.of(
                "claude config set hasCompletedProjectOnboarding true",
                "claude config set hasTrustDialogAccepted true",
                "claude config set allowedTools [\"Bash\",\"Read\",\"Write\",\"Edit\",\"Create\"]"));
        private Duration setupTimeout = Duration.ofSeconds(30);

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public List<String> getArguments() { return arguments; }
        public void setArguments(List<String> arguments) { this.arguments = arguments; }
        public List<String> getSetupCommands() { return setupCommands; }
        public void setSetupCommands(List<String> setupCommands) { this.setupCommands = setupCommands; }
        public Duration getSetupTimeout() { return setupTimeout; }
        public void setSetupTimeout(Duration setupTimeout) { this.setupTimeout = setupTimeout; }
    }
}
