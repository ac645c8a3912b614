package com.dispense.tunnel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local TCP listener on an ephemeral loopback port whose connections are each forwarded to
 * a fixed target through a {@link ChannelDialer}.
 * <p>
 * {@link #start} returns only once the listener is accepting, so the address handed out is
 * immediately usable. {@link #close()} stops accepting, tears down every forwarded
 * connection, stops all worker threads and closes the dialer; it may be called any number
 * of times.
 */
public final class PortForwarder implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PortForwarder.class);

    private final ChannelDialer dialer;
    private final String targetHost;
    private final int targetPort;
    private final ServerSocket listener;
    private final ExecutorService workers;
    private final CompletableFuture<Integer> ready = new CompletableFuture<>();
    private final Set<Closeable> openConnections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger forwarded = new AtomicInteger();

    private PortForwarder(ChannelDialer dialer, String targetHost, int targetPort) throws IOException {
        this.dialer = dialer;
        this.targetHost = targetHost;
        this.targetPort = targetPort;
        this.listener = new ServerSocket();
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tunnel-" + targetPort + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts forwarding and waits until the local listener is ready.
     *
     * @throws IOException if the listener cannot be bound within {@code readyTimeout}
     */
    public static PortForwarder start(ChannelDialer dialer, String targetHost, int targetPort,
                                      Duration readyTimeout) throws IOException {
        PortForwarder forwarder = new PortForwarder(dialer, targetHost, targetPort);
        forwarder.workers.execute(forwarder::acceptLoop);
        try {
            int port = forwarder.ready.get(readyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Forwarding 127.0.0.1:{} -> {}:{}", port, targetHost, targetPort);
            return forwarder;
        } catch (TimeoutException e) {
            forwarder.close();
            throw new IOException("Local listener not ready after " + readyTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            forwarder.close();
            throw new IOException("Local listener failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forwarder.close();
            throw new IOException("Interrupted while waiting for local listener", e);
        }
    }

    public String host() {
        return "127.0.0.1";
    }

    public int localPort() {
        return listener.getLocalPort();
    }

    /** Number of connections forwarded since start. */
    public int forwardedCount() {
        return forwarded.get();
    }

    public int openConnectionCount() {
        return openConnections.size();
    }

    /** True once closed and every worker thread has exited. */
    public boolean isTerminated() {
        return closed.get() && workers.isTerminated();
    }

    private void acceptLoop() {
        try {
            listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            ready.complete(listener.getLocalPort());
            while (!closed.get()) {
                Socket local = listener.accept();
                forwarded.incrementAndGet();
                workers.execute(() -> forward(local));
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("Tunnel listener stopped: {}", e.getMessage());
            }
            ready.completeExceptionally(e);
        }
    }

    private void forward(Socket local) {
        openConnections.add(local);
        TunnelConnection remote = null;
        try {
            remote = dialer.dial(targetHost, targetPort);
            openConnections.add(remote);
            if (closed.get()) {
                return;
            }
            TunnelConnection upstreamTarget = remote;
            InputStream localIn = local.getInputStream();
            OutputStream localOut = local.getOutputStream();
            workers.execute(() -> pumpUpstream(localIn, upstreamTarget));
            remote.input().transferTo(localOut);
            localOut.flush();
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("Forwarded connection to {}:{} ended: {}", targetHost, targetPort, e.getMessage());
            }
        } finally {
            closeConnection(local);
            if (remote != null) {
                closeConnection(remote);
            }
        }
    }

    private void pumpUpstream(InputStream localIn, TunnelConnection remote) {
        try {
            OutputStream remoteOut = remote.output();
            localIn.transferTo(remoteOut);
            remoteOut.flush();
            remote.shutdownOutput();
        } catch (IOException e) {
            log.debug("Upstream copy to {}:{} ended: {}", targetHost, targetPort, e.getMessage());
        }
    }

    private void closeConnection(Closeable connection) {
        openConnections.remove(connection);
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Closing forwarded connection failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            listener.close();
        } catch (IOException e) {
            log.debug("Closing tunnel listener failed: {}", e.getMessage());
        }
        for (Closeable connection : openConnections) {
            closeConnection(connection);
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Tunnel workers still running after close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            dialer.close();
        } catch (IOException e) {
            log.debug("Closing secure channel failed: {}", e.getMessage());
        }
        log.debug("Tunnel on port {} closed", listener.getLocalPort());
    }
}
