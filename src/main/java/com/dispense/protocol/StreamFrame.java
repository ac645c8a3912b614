package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One unit of live task output delivered over a stream.
 *
 * @param type      STDOUT, STDERR, STATUS or ERROR
 * @param content   line payload (without the log prefix)
 * @param timestamp epoch seconds of the originating log line
 * @param exitCode  set only on the final frame
 * @param finished  true only on the final frame of a stream
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamFrame(
        @JsonProperty("type") FrameType type,
        @JsonProperty("content") String content,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("finished") boolean finished
) {

    public static StreamFrame of(FrameType type, String content, Instant at) {
        return new StreamFrame(type, content, at.getEpochSecond(), null, false);
    }

    public static StreamFrame completion(int exitCode, String content) {
        return new StreamFrame(FrameType.STATUS, content, Instant.now().getEpochSecond(), exitCode, true);
    }

    public static StreamFrame error(String message) {
        return new StreamFrame(FrameType.ERROR, message, Instant.now().getEpochSecond(), null, false);
    }

    @JsonIgnore
    public boolean succeeded() {
        return finished && exitCode != null && exitCode == 0;
    }
}
