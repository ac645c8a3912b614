package com.dispense.protocol;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single line of a task log sink: {@code [<RFC3339 timestamp>] [<TYPE>] <payload>}.
 * <p>
 * Payloads are stored verbatim. Lines that do not match the format are reported as
 * unparsable so readers can fall back to showing them raw.
 */
public record LogLine(String timestamp, String type, String payload) {

    private static final Pattern LINE = Pattern.compile("^\\[([^\\]]+)\\] \\[([^\\]]+)\\] (.*)$", Pattern.DOTALL);

    public static Optional<LogLine> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new LogLine(m.group(1), m.group(2), m.group(3)));
    }

    /** Renders one log line, without the trailing newline. */
    public static String format(Instant at, FrameType type, String payload) {
        String ts = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                at.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
        return "[" + ts + "] [" + type.name() + "] " + (payload == null ? "" : payload);
    }

    public Optional<FrameType> frameType() {
        return FrameType.fromLabel(type);
    }

    public Optional<Instant> instant() {
        try {
            return Optional.of(OffsetDateTime.parse(timestamp).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Converts the line into the frame a streaming consumer receives. */
    public StreamFrame toFrame() {
        return StreamFrame.of(frameType().orElse(FrameType.STDOUT), payload, instant().orElseGet(Instant::now));
    }

    /** Frame for a line that could not be parsed: the whole line is the content. */
    public static StreamFrame rawFrame(String line) {
        return StreamFrame.of(FrameType.STDOUT, line, Instant.now());
    }
}
