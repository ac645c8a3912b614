package com.dispense.tunnel;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens SSH tunnels through the remote provider's relay. The relay authenticates the
 * short-lived access token passed as the user name; its host key is not pinned.
 */
public class SshTunnelFactory {

    private static final Logger log = LoggerFactory.getLogger(SshTunnelFactory.class);

    private final String relayHost;
    private final int relayPort;
    private final Duration connectTimeout;
    private final Duration readyTimeout;

    public SshTunnelFactory(String relayHost, int relayPort, Duration connectTimeout, Duration readyTimeout) {
        this.relayHost = relayHost;
        this.relayPort = relayPort;
        this.connectTimeout = connectTimeout;
        this.readyTimeout = readyTimeout;
    }

    /**
     * Connects to the relay and forwards an ephemeral local port to {@code targetHost:targetPort}
     * inside the sandbox.
     *
     * @return an endpoint for the local side; closing it tears down the forwarder and the session
     */
    public DaemonEndpoint open(String accessToken, String targetHost, int targetPort) {
        Session session;
        try {
            session = new JSch().getSession(accessToken, relayHost, relayPort);
            session.setConfig("StrictHostKeyChecking", "no");
            session.setServerAliveInterval((int) Duration.ofSeconds(30).toMillis());
            session.connect((int) connectTimeout.toMillis());
        } catch (JSchException e) {
            throw new DispenseException(ErrorCode.TUNNEL_FAILED,
                    "Failed to connect to " + relayHost + ":" + relayPort + ": " + e.getMessage(), e);
        }

        ChannelDialer dialer = new JschChannelDialer(session, (int) connectTimeout.toMillis());
        return forward(dialer, targetHost, targetPort, readyTimeout);
    }

    /** Starts a forwarder over an already-connected dialer. */
    static DaemonEndpoint forward(ChannelDialer dialer, String targetHost, int targetPort, Duration readyTimeout) {
        try {
            PortForwarder forwarder = PortForwarder.start(dialer, targetHost, targetPort, readyTimeout);
            log.info("Tunnel ready on {}:{} -> {}:{}", forwarder.host(), forwarder.localPort(), targetHost, targetPort);
            return DaemonEndpoint.tunneled(forwarder.host(), forwarder.localPort(), forwarder::close);
        } catch (IOException e) {
            try {
                dialer.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw new DispenseException(ErrorCode.TUNNEL_FAILED, "Tunnel setup failed: " + e.getMessage(), e);
        }
    }
}
