package com.dispense.tunnel;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * One bidirectional byte stream to the remote target, opened over the secure channel.
 */
public interface TunnelConnection extends Closeable {

    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    /** Signals end of data towards the remote side while still reading its replies. */
    void shutdownOutput() throws IOException;
}
