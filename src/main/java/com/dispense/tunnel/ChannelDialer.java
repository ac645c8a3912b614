package com.dispense.tunnel;

import java.io.Closeable;
import java.io.IOException;

/**
 * Opens connections to a host and port as seen from the far end of a secure channel.
 * Closing the dialer closes the channel and every connection opened through it.
 */
public interface ChannelDialer extends Closeable {

    TunnelConnection dial(String host, int port) throws IOException;
}
