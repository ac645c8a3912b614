package com.dispense.cli;

import com.dispense.client.DaemonClient;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.tunnel.DaemonEndpoint;

/**
 * An open connection to the daemon of one sandbox. Closing it releases the tunnel, if any.
 *
 * @param client       client for regular calls, bounded by the request timeout
 * @param statusClient client for status polling, bounded by the shorter status timeout
 */
record DaemonSession(SandboxInfo sandbox, DaemonEndpoint endpoint, DaemonClient client,
                     DaemonClient statusClient) implements AutoCloseable {

    @Override
    public void close() {
        endpoint.close();
    }
}
