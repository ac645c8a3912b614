package com.dispense.client;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.protocol.StreamFrame;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Iterator over the {@code frame} events of a daemon SSE response.
 * Comment lines (heartbeats) and other event names are skipped. Closing the stream closes
 * the connection.
 */
public final class FrameStream implements Iterator<StreamFrame>, AutoCloseable {

    private static final String FRAME_EVENT = "frame";

    private final Stream<String> lines;
    private final Iterator<String> iterator;
    private final ObjectMapper objectMapper;
    private final String taskId;
    private StreamFrame pending;
    private boolean exhausted;

    FrameStream(Stream<String> lines, ObjectMapper objectMapper) {
        this(lines, objectMapper, null);
    }

    FrameStream(Stream<String> lines, ObjectMapper objectMapper, String taskId) {
        this.lines = lines;
        this.iterator = lines.iterator();
        this.objectMapper = objectMapper;
        this.taskId = taskId;
    }

    /** Id of the task behind this stream, or null when the daemon did not report one. */
    public String taskId() {
        return taskId;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = readFrame();
            exhausted = pending == null;
        }
        return pending != null;
    }

    @Override
    public StreamFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        StreamFrame frame = pending;
        pending = null;
        return frame;
    }

    /**
     * Hands every frame before the final one to {@code consumer} and returns the final frame.
     *
     * @throws DispenseException {@code DAEMON_UNAVAILABLE} if the stream ends early
     */
    public StreamFrame drainTo(Consumer<StreamFrame> consumer) {
        while (hasNext()) {
            StreamFrame frame = next();
            if (frame.finished()) {
                return frame;
            }
            consumer.accept(frame);
        }
        throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Stream ended before the task finished");
    }

    @Override
    public void close() {
        lines.close();
    }

    private StreamFrame readFrame() {
        StringBuilder data = new StringBuilder();
        String event = null;
        try {
            while (iterator.hasNext()) {
                String line = iterator.next();
                if (line.isEmpty()) {
                    if (data.length() > 0 && (event == null || FRAME_EVENT.equals(event))) {
                        return parse(data.toString());
                    }
                    data.setLength(0);
                    event = null;
                } else if (line.startsWith(":")) {
                    continue;
                } else if (line.startsWith("event:")) {
                    event = value(line, 6);
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(value(line, 5));
                }
            }
        } catch (UncheckedIOException e) {
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Connection to daemon lost: " + e.getMessage(), e);
        }
        if (data.length() > 0 && (event == null || FRAME_EVENT.equals(event))) {
            return parse(data.toString());
        }
        return null;
    }

    private StreamFrame parse(String json) {
        try {
            return objectMapper.readValue(json, StreamFrame.class);
        } catch (IOException e) {
            throw new DispenseException(ErrorCode.DAEMON_UNAVAILABLE, "Malformed frame from daemon: " + e.getMessage(), e);
        }
    }

    private static String value(String line, int prefixLength) {
        String value = line.substring(prefixLength);
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
