package com.dispense.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a {@link StreamFrame} and of a line in a task log sink.
 * The enum name doubles as the {@code [TYPE]} label written into log lines.
 */
public enum FrameType {
    STDOUT,
    STDERR,
    STATUS,
    ERROR;

    public static Optional<FrameType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
