package com.dispense.tunnel;

import com.jcraft.jsch.ChannelDirectTCPIP;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Dials through an authenticated SSH session using direct-tcpip channels, so the target
 * address is resolved on the remote side.
 */
public class JschChannelDialer implements ChannelDialer {

    private final Session session;
    private final int channelConnectTimeoutMs;

    public JschChannelDialer(Session session, int channelConnectTimeoutMs) {
        this.session = session;
        this.channelConnectTimeoutMs = channelConnectTimeoutMs;
    }

    @Override
    public TunnelConnection dial(String host, int port) throws IOException {
        try {
            ChannelDirectTCPIP channel;
            synchronized (session) {
                channel = (ChannelDirectTCPIP) session.openChannel("direct-tcpip");
            }
            channel.setHost(host);
            channel.setPort(port);
            InputStream in = channel.getInputStream();
            OutputStream out = channel.getOutputStream();
            channel.connect(channelConnectTimeoutMs);
            return new ChannelConnection(channel, in, out);
        } catch (JSchException e) {
            throw new IOException("Failed to open channel to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        session.disconnect();
    }

    private record ChannelConnection(ChannelDirectTCPIP channel, InputStream in, OutputStream out)
            implements TunnelConnection {

        @Override
        public InputStream input() {
            return in;
        }

        @Override
        public OutputStream output() {
            return out;
        }

        @Override
        public void shutdownOutput() throws IOException {
            out.close();
        }

        @Override
        public void close() {
            channel.disconnect();
        }
    }
}
