package com.dispense.cli;

import com.dispense.sandbox.SandboxType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dispense.controller")
public class ControllerProperties {

    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration statusTimeout = Duration.ofSeconds(5);
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration missingFileRetry = Duration.ofSeconds(1);
    private Duration waitInterval = Duration.ofSeconds(2);
    private String remoteLogDir = "/home/daytona/.dispense/logs";
    private String localLogDir = "/root/.dispense/logs";
    private String anthropicApiKey;

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getStatusTimeout() { return statusTimeout; }
    public void setStatusTimeout(Duration statusTimeout) { this.statusTimeout = statusTimeout; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getMissingFileRetry() { return missingFileRetry; }
    public void setMissingFileRetry(Duration missingFileRetry) { this.missingFileRetry = missingFileRetry; }
    public Duration getWaitInterval() { return waitInterval; }
    public void setWaitInterval(Duration waitInterval) { this.waitInterval = waitInterval; }
    public String getRemoteLogDir() { return remoteLogDir; }
    public void setRemoteLogDir(String remoteLogDir) { this.remoteLogDir = remoteLogDir; }
    public String getLocalLogDir() { return localLogDir; }
    public void setLocalLogDir(String localLogDir) { this.localLogDir = localLogDir; }
    public String getAnthropicApiKey() { return anthropicApiKey; }
    public void setAnthropicApiKey(String anthropicApiKey) { this.anthropicApiKey = anthropicApiKey; }

    /** Directory holding task logs inside a sandbox of the given type. */
    public String logDirFor(SandboxType type) {
        return type == SandboxType.REMOTE ? remoteLogDir : localLogDir;
    }
}
