package com.dispense.follow;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Random access to task log files wherever they live.
 */
public interface LogSource {

    /** Current size in bytes, or empty if the file does not exist (yet). */
    OptionalLong size(String path);

    /** Reads up to {@code length} bytes starting at {@code offset}. */
    byte[] read(String path, long offset, int length);

    /** Path of the most recently modified task log in {@code directory}. */
    Optional<String> latestLog(String directory);
}
