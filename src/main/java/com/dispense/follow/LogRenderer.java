package com.dispense.follow;

import com.dispense.protocol.FrameType;
import com.dispense.protocol.LogLine;
import com.dispense.protocol.StreamFrame;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns task log lines and stream frames into terminal output. Each frame payload is fed
 * to the {@link WorkingStateClassifier} before it is rendered.
 */
public class LogRenderer {

    private static final DateTimeFormatter CLOCK =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private final RenderMode mode;
    private final Consumer<String> out;
    private final WorkingStateClassifier classifier;
    private final AgentMessageDecoder decoder;

    public LogRenderer(RenderMode mode, Consumer<String> out,
                       WorkingStateClassifier classifier, AgentMessageDecoder decoder) {
        this.mode = mode;
        this.out = out;
        this.classifier = classifier;
        this.decoder = decoder;
    }

    /** Renders one complete line read from a task log file. */
    public void renderLine(String line) {
        if (mode == RenderMode.RAW) {
            out.accept(line);
            return;
        }
        Optional<LogLine> parsed = LogLine.parse(line);
        if (parsed.isEmpty()) {
            if (mode == RenderMode.HUMAN) {
                out.accept(line);
            } else if (looksLikeProblem(line)) {
                out.accept("[warn] " + line);
            }
            return;
        }
        renderFrame(parsed.get().toFrame());
    }

    public void renderFrame(StreamFrame frame) {
        if (mode == RenderMode.RAW) {
            out.accept(LogLine.format(Instant.ofEpochSecond(frame.timestamp()), frame.type(), frame.content()));
            return;
        }
        String time = CLOCK.format(Instant.ofEpochSecond(frame.timestamp()));
        switch (frame.type()) {
            case STDOUT -> renderAgentOutput(time, frame.content());
            case STDERR -> out.accept(time + " [stderr] " + frame.content());
            case ERROR -> out.accept(time + " [error] " + frame.content());
            case STATUS -> {
                if (mode == RenderMode.HUMAN || frame.finished()) {
                    out.accept(time + " [status] " + frame.content());
                }
            }
        }
    }

    private void renderAgentOutput(String time, String payload) {
        AgentMessage message = decoder.decode(payload);
        classifier.update(message);
        if (mode == RenderMode.HUMAN) {
            renderHuman(time, message);
        } else {
            renderFollow(message);
        }
    }

    private void renderHuman(String time, AgentMessage message) {
        if (message instanceof AgentMessage.User user) {
            out.accept(time + " [user] " + user.text());
        } else if (message instanceof AgentMessage.ToolResult tool) {
            out.accept(time + (tool.error() ? " [tool error] " : " [tool] ") + firstLine(tool.content()));
        } else if (message instanceof AgentMessage.Assistant assistant) {
            for (AgentMessage.ContentBlock block : assistant.content()) {
                if (block.isToolUse()) {
                    out.accept(time + " [tool use] " + toolUse(block));
                } else if (block.isText() && block.text() != null && !block.text().isBlank()) {
                    out.accept(time + " [assistant] " + block.text());
                }
            }
        } else if (message instanceof AgentMessage.SystemInit system) {
            out.accept(time + " [system] " + (system.subtype() != null ? system.subtype() : "init")
                    + (system.model() != null ? " model=" + system.model() : "")
                    + (system.workingDirectory() != null ? " cwd=" + system.workingDirectory() : "")
                    + (system.tools().isEmpty() ? "" : " tools=" + system.tools().size()));
        } else if (message instanceof AgentMessage.StreamEvent) {
            // partial message events carry no text worth printing
        } else if (message instanceof AgentMessage.Result result) {
            out.accept(time + " [result] " + summary(result));
        } else if (message instanceof AgentMessage.Raw raw) {
            out.accept(time + " " + raw.text());
        }
    }

    private void renderFollow(AgentMessage message) {
        if (message instanceof AgentMessage.Assistant assistant) {
            for (AgentMessage.ContentBlock block : assistant.content()) {
                if (block.isToolUse()) {
                    out.accept("> " + toolUse(block));
                } else if (block.isText() && block.text() != null && !block.text().isBlank()) {
                    out.accept(block.text());
                }
            }
        } else if (message instanceof AgentMessage.ToolResult tool && tool.error()) {
            out.accept("[warn] tool failed: " + firstLine(tool.content()));
        } else if (message instanceof AgentMessage.Result result) {
            out.accept("[result] " + summary(result));
        } else if (message instanceof AgentMessage.Raw raw && looksLikeProblem(raw.text())) {
            out.accept("[warn] " + raw.text());
        }
    }

    static String summary(AgentMessage.Result result) {
        StringBuilder sb = new StringBuilder(result.error() ? "failed" : "done");
        if (result.durationMs() != null) {
            sb.append(" in ").append(String.format(Locale.ROOT, "%.1fs", result.durationMs() / 1000.0));
        }
        if (result.inputTokens() != null || result.outputTokens() != null) {
            sb.append(", tokens ")
                    .append(result.inputTokens() != null ? result.inputTokens() : 0).append(" in / ")
                    .append(result.outputTokens() != null ? result.outputTokens() : 0).append(" out");
        }
        if (result.totalCostUsd() != null) {
            sb.append(String.format(Locale.ROOT, ", $%.4f", result.totalCostUsd()));
        }
        return sb.toString();
    }

    private static String toolUse(AgentMessage.ContentBlock block) {
        String name = block.name() != null ? block.name() : "tool";
        return block.input() != null ? name + " " + block.input() : name;
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline) + " ...";
    }

    private static boolean looksLikeProblem(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("error") || lower.contains("warn") || lower.contains("fail");
    }
}
