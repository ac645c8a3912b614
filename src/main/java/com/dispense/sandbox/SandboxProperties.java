package com.dispense.sandbox;

import com.dispense.daemon.DaemonProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dispense.sandbox")
public class SandboxProperties {

    private String image = "vedranjukic/dispense-sandbox:0.0.1";
    private String workDir = "/workspace";
    private String dockerHost = "unix:///var/run/docker.sock";
    private int daemonPort = DaemonProperties.DEFAULT_PORT;
    private String daemonInstallDir = "/usr/local/lib/dispense";
    private Duration daemonStartTimeout = Duration.ofSeconds(30);
    private int memoryLimitMb = 4096;
    private int cpuCount = 2;

    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }
    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public int getDaemonPort() { return daemonPort; }
    public void setDaemonPort(int daemonPort) { this.daemonPort = daemonPort; }
    public String getDaemonInstallDir() { return daemonInstallDir; }
    public void setDaemonInstallDir(String daemonInstallDir) { this.daemonInstallDir = daemonInstallDir; }
    public Duration getDaemonStartTimeout() { return daemonStartTimeout; }
    public void setDaemonStartTimeout(Duration daemonStartTimeout) { this.daemonStartTimeout = daemonStartTimeout; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
}
