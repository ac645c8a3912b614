package com.dispense.sandbox;

import com.dispense.sandbox.remote.RemoteApiClient;
import com.dispense.sandbox.remote.RemoteProperties;
import com.dispense.sandbox.remote.RemoteSandboxProvider;
import com.dispense.tunnel.SshTunnelFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Controller-side wiring: providers, the sandbox directory and the tunnel factory.
 */
@Configuration
public class SandboxConfig {

    @Bean
    public DockerClient dockerClient(SandboxProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDockerHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public DockerSandboxProvider dockerSandboxProvider(DockerClient dockerClient, SandboxProperties properties) {
        return new DockerSandboxProvider(dockerClient, properties);
    }

    @Bean
    public SshTunnelFactory sshTunnelFactory(RemoteProperties properties) {
        return new SshTunnelFactory(properties.getSshHost(), properties.getSshPort(),
                properties.getSshConnectTimeout(), properties.getTunnelReadyTimeout());
    }

    @Bean
    public RemoteApiClient remoteApiClient(RemoteProperties properties, ObjectMapper objectMapper) {
        return new RemoteApiClient(properties, objectMapper);
    }

    @Bean
    public RemoteSandboxProvider remoteSandboxProvider(RemoteApiClient api,
                                                       RemoteProperties properties,
                                                       SandboxProperties sandboxProperties,
                                                       SshTunnelFactory tunnelFactory,
                                                       ObjectMapper objectMapper) {
        return new RemoteSandboxProvider(api, properties, sandboxProperties, tunnelFactory, objectMapper);
    }

    @Bean
    public SandboxDirectory sandboxDirectory(DockerSandboxProvider local, RemoteSandboxProvider remote) {
        return new SandboxDirectory(List.of(local, remote));
    }
}
