package com.dispense.follow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes agent stream-json lines. Never throws: malformed input becomes
 * {@link AgentMessage.Raw}.
 */
public class AgentMessageDecoder {

    private static final int MAX_INPUT_PREVIEW = 80;

    private final ObjectMapper objectMapper;

    public AgentMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AgentMessage decode(String line) {
        if (line == null) {
            return new AgentMessage.Raw("");
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return new AgentMessage.Raw(line);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (IOException e) {
            return new AgentMessage.Raw(line);
        }
        if (node == null || !node.isObject()) {
            return new AgentMessage.Raw(line);
        }
        return switch (node.path("type").asText("")) {
            case "user" -> decodeUser(node);
            case "assistant" -> decodeAssistant(node);
            case "system" -> new AgentMessage.SystemInit(
                    node.path("subtype").asText(null),
                    node.path("cwd").asText(null),
                    node.path("model").asText(null),
                    strings(node.path("tools")));
            case "stream_event" -> new AgentMessage.StreamEvent(node.path("event").path("type").asText(""));
            case "result" -> decodeResult(node);
            default -> new AgentMessage.Raw(line);
        };
    }

    private AgentMessage decodeUser(JsonNode node) {
        JsonNode content = node.path("message").path("content");
        if (content.isTextual()) {
            return new AgentMessage.User(content.asText());
        }
        for (JsonNode block : content) {
            if ("tool_result".equals(block.path("type").asText())) {
                JsonNode result = block.path("content");
                String text = result.isTextual() ? result.asText() : result.toString();
                return new AgentMessage.ToolResult(block.path("tool_use_id").asText(null), text,
                        block.path("is_error").asBoolean(false));
            }
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            text.append(block.path("text").asText(""));
        }
        return new AgentMessage.User(text.toString());
    }

    private AgentMessage decodeAssistant(JsonNode node) {
        JsonNode message = node.path("message");
        List<AgentMessage.ContentBlock> blocks = new ArrayList<>();
        for (JsonNode block : message.path("content")) {
            String type = block.path("type").asText("");
            String input = block.has("input") ? preview(block.get("input").toString()) : null;
            blocks.add(new AgentMessage.ContentBlock(type, block.path("text").asText(null),
                    block.path("name").asText(null), input));
        }
        return new AgentMessage.Assistant(message.path("model").asText(null), blocks);
    }

    private AgentMessage decodeResult(JsonNode node) {
        JsonNode usage = node.path("usage");
        return new AgentMessage.Result(
                node.path("subtype").asText(null),
                node.path("is_error").asBoolean(false),
                longOrNull(node.path("duration_ms")),
                longOrNull(usage.path("input_tokens")),
                longOrNull(usage.path("output_tokens")),
                node.hasNonNull("total_cost_usd") ? node.get("total_cost_usd").asDouble() : null,
                node.path("result").asText(null));
    }

    private static Long longOrNull(JsonNode node) {
        return node.isNumber() ? node.asLong() : null;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            values.add(item.asText());
        }
        return values;
    }

    private static String preview(String text) {
        return text.length() <= MAX_INPUT_PREVIEW ? text : text.substring(0, MAX_INPUT_PREVIEW - 3) + "...";
    }
}
