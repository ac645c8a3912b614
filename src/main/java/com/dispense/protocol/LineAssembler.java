package com.dispense.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits an append-only byte stream, delivered in arbitrary chunks, into complete lines.
 * A trailing partial line is held back until its newline arrives or {@link #flush()} is called.
 * Not thread-safe.
 */
public final class LineAssembler {

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public List<String> push(byte[] chunk) {
        return push(chunk, 0, chunk.length);
    }

    public List<String> push(byte[] chunk, int offset, int length) {
        List<String> lines = new ArrayList<>();
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (chunk[i] == '\n') {
                pending.write(chunk, start, i - start);
                lines.add(takePending());
                start = i + 1;
            }
        }
        if (start < end) {
            pending.write(chunk, start, end - start);
        }
        return lines;
    }

    /** Returns the held-back partial line, if any, and resets. */
    public Optional<String> flush() {
        if (pending.size() == 0) {
            return Optional.empty();
        }
        return Optional.of(takePending());
    }

    public boolean hasPending() {
        return pending.size() > 0;
    }

    private String takePending() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }
}
