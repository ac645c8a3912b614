package com.dispense.follow;

import java.util.List;

/**
 * One decoded line of the agent's stream-json output. Anything that is not valid JSON or
 * has an unknown type decodes to {@link Raw}.
 */
public sealed interface AgentMessage {

    /** A prompt or follow-up sent to the agent. */
    record User(String text) implements AgentMessage {}

    /** Tool output fed back to the agent. */
    record ToolResult(String toolUseId, String content, boolean error) implements AgentMessage {}

    record Assistant(String model, List<ContentBlock> content) implements AgentMessage {

        public Assistant {
            content = content == null ? List.of() : List.copyOf(content);
        }

        public String text() {
            StringBuilder sb = new StringBuilder();
            for (ContentBlock block : content) {
                if (block.isText() && block.text() != null) {
                    sb.append(block.text());
                }
            }
            return sb.toString();
        }
    }

    /** Session initialization details. */
    record SystemInit(String subtype, String workingDirectory, String model, List<String> tools) implements AgentMessage {

        public SystemInit {
            tools = tools == null ? List.of() : List.copyOf(tools);
        }
    }

    /** Incremental event while a response is being produced. */
    record StreamEvent(String eventType) implements AgentMessage {}

    /** Final summary of the run. */
    record Result(String subtype, boolean error, Long durationMs, Long inputTokens, Long outputTokens,
                  Double totalCostUsd, String result) implements AgentMessage {}

    record Raw(String text) implements AgentMessage {}

    /**
     * @param type  "text" or "tool_use"
     * @param text  text of a text block
     * @param name  tool name of a tool_use block
     * @param input short rendering of the tool input
     */
    record ContentBlock(String type, String text, String name, String input) {

        public boolean isText() {
            return "text".equals(type);
        }

        public boolean isToolUse() {
            return "tool_use".equals(type);
        }
    }
}
