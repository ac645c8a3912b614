package com.dispense.sandbox.remote;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dispense.remote")
public class RemoteProperties {

    private String apiUrl = "https://app.daytona.io/api";
    private String apiKey;
    private String target;
    private String snapshot;
    private String sshHost = "ssh.app.daytona.io";
    private int sshPort = 22;
    private int sshAccessMinutes = 10;
    private Duration sshConnectTimeout = Duration.ofSeconds(30);
    private Duration tunnelReadyTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private Duration startTimeout = Duration.ofMinutes(2);
    private String daemonInstallDir = "/home/daytona/.dispense/bin";

    public String getApiUrl() { return apiUrl; }
    public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }
    public String getSnapshot() { return snapshot; }
    public void setSnapshot(String snapshot) { this.snapshot = snapshot; }
    public String getSshHost() { return sshHost; }
    public void setSshHost(String sshHost) { this.sshHost = sshHost; }
    public int getSshPort() { return sshPort; }
    public void setSshPort(int sshPort) { this.sshPort = sshPort; }
    public int getSshAccessMinutes() { return sshAccessMinutes; }
    public void setSshAccessMinutes(int sshAccessMinutes) { this.sshAccessMinutes = sshAccessMinutes; }
    public Duration getSshConnectTimeout() { return sshConnectTimeout; }
    public void setSshConnectTimeout(Duration sshConnectTimeout) { this.sshConnectTimeout = sshConnectTimeout; }
    public Duration getTunnelReadyTimeout() { return tunnelReadyTimeout; }
    public void setTunnelReadyTimeout(Duration tunnelReadyTimeout) { this.tunnelReadyTimeout = tunnelReadyTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getStartTimeout() { return startTimeout; }
    public void setStartTimeout(Duration startTimeout) { this.startTimeout = startTimeout; }
    public String getDaemonInstallDir() { return daemonInstallDir; }
    public void setDaemonInstallDir(String daemonInstallDir) { this.daemonInstallDir = daemonInstallDir; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
