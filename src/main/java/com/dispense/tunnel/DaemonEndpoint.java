package com.dispense.tunnel;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Address at which a sandbox's daemon can be reached, plus whatever must be torn down
 * when the caller is done (a tunnel, for remote sandboxes). Closing is idempotent.
 */
public final class DaemonEndpoint implements AutoCloseable {

    private final String host;
    private final int port;
    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean();

    private DaemonEndpoint(String host, int port, Runnable release) {
        this.host = host;
        this.port = port;
        this.release = release;
    }

    /** An endpoint reachable without a tunnel; closing it does nothing. */
    public static DaemonEndpoint direct(String host, int port) {
        return new DaemonEndpoint(host, port, null);
    }

    /** An endpoint behind a local forwarder; {@code release} tears the forwarder down. */
    public static DaemonEndpoint tunneled(String host, int port, Runnable release) {
        return new DaemonEndpoint(host, port, release);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String address() {
        return host + ":" + port;
    }

    public URI baseUri() {
        return URI.create("http://" + address());
    }

    public boolean isTunneled() {
        return release != null;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true) && release != null) {
            release.run();
        }
    }

    @Override
    public String toString() {
        return (isTunneled() ? "tunnel:" : "direct:") + address();
    }
}
