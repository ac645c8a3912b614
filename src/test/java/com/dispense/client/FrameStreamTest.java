package com.dispense.client;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.protocol.FrameType;
import com.dispense.protocol.StreamFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FrameStreamTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FrameStream stream(String... lines) {
        return new FrameStream(Stream.of(lines), objectMapper);
    }

    @Test
    void parsesFramesAndSkipsHeartbeatsAndOtherEvents() {
        FrameStream frames = stream(
                ":heartbeat",
                "",
                "event:frame",
                "data:{\"type\":\"STDOUT\",\"content\":\"hello\",\"timestamp\":1700000000,\"finished\":false}",
                "",
                "event:other",
                "data:{\"ignored\":true}",
                "",
                "event: frame",
                "data: {\"type\":\"STATUS\",\"content\":\"Task completed with exit code 0\",\"timestamp\":1700000001,"
                        + "\"exit_code\":0,\"finished\":true}",
                "");

        List<StreamFrame> received = new ArrayList<>();
        frames.forEachRemaining(received::add);

        assertEquals(2, received.size());
        assertEquals(FrameType.STDOUT, received.get(0).type());
        assertEquals("hello", received.get(0).content());
        assertEquals(1700000000L, received.get(0).timestamp());
        assertTrue(received.get(1).succeeded());
    }

    @Test
    void drainToReturnsFinalFrameWithoutDeliveringIt() {
        FrameStream frames = stream(
                "data:{\"type\":\"STDERR\",\"content\":\"warn\",\"timestamp\":1,\"finished\":false}",
                "",
                "data:{\"type\":\"STATUS\",\"content\":\"done\",\"timestamp\":2,\"exit_code\":3,\"finished\":true}");

        List<StreamFrame> delivered = new ArrayList<>();
        StreamFrame last = frames.drainTo(delivered::add);

        assertEquals(1, delivered.size());
        assertEquals(3, last.exitCode());
        assertFalse(last.succeeded());
    }

    @Test
    void streamEndingBeforeFinalFrameIsDaemonUnavailable() {
        FrameStream frames = stream(
                "data:{\"type\":\"STDOUT\",\"content\":\"x\",\"timestamp\":1,\"finished\":false}",
                "");

        var e = assertThrows(DispenseException.class, () -> frames.drainTo(f -> { }));
        assertEquals(ErrorCode.DAEMON_UNAVAILABLE, e.code());
    }

    @Test
    void brokenConnectionAndMalformedFramesAreDaemonUnavailable() {
        FrameStream broken = new FrameStream(Stream.<String>generate(() -> {
            throw new UncheckedIOException(new IOException("reset"));
        }), objectMapper);
        assertEquals(ErrorCode.DAEMON_UNAVAILABLE, assertThrows(DispenseException.class, broken::hasNext).code());

        FrameStream malformed = stream("data:{oops", "");
        assertEquals(ErrorCode.DAEMON_UNAVAILABLE, assertThrows(DispenseException.class, malformed::next).code());
    }

    @Test
    void closeClosesTheUnderlyingLines() {
        AtomicBoolean closed = new AtomicBoolean();
        FrameStream frames = new FrameStream(Stream.<String>empty().onClose(() -> closed.set(true)), objectMapper);

        frames.close();

        assertTrue(closed.get());
        assertFalse(frames.hasNext());
    }
}
