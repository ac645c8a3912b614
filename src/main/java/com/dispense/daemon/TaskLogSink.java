package com.dispense.daemon;

import com.dispense.protocol.FrameType;
import com.dispense.protocol.LogLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Append-only log file of one task. Every line is flushed to disk before {@link #append}
 * returns, so a reader that observes a size sees whole lines up to that size.
 * <p>
 * Writes after {@link #close()} are dropped; a failed write is logged and never propagates
 * into the task.
 */
public final class TaskLogSink implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(TaskLogSink.class);

    private final Path path;
    private final FileChannel channel;
    private boolean closed;

    private TaskLogSink(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
        this.closed = channel == null;
    }

    public static TaskLogSink open(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        return new TaskLogSink(path, channel);
    }

    /** A sink whose file could not be created; every append is a no-op. */
    public static TaskLogSink unavailable(Path path) {
        return new TaskLogSink(path, null);
    }

    public synchronized boolean append(FrameType type, String payload) {
        if (closed) {
            return false;
        }
        String line = LogLine.format(Instant.now(), type, payload) + "\n";
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write to task log {}: {}", path, e.getMessage());
            return false;
        }
    }

    public Path path() {
        return path;
    }

    public synchronized boolean isOpen() {
        return !closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close task log {}: {}", path, e.getMessage());
        }
    }
}
