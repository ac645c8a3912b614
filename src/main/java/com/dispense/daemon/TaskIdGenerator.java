package com.dispense.daemon;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out task ids of the form {@code claude_<epoch-nanos>}.
 * Two calls never return the same id, even when the clock does not advance between them.
 */
public class TaskIdGenerator {

    static final String PREFIX = "claude_";

    private final AtomicLong last = new AtomicLong();

    public String next() {
        Instant now = Instant.now();
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        long id = last.updateAndGet(prev -> Math.max(prev + 1, nanos));
        return PREFIX + id;
    }
}
