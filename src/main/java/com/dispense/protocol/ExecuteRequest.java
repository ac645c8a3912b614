package com.dispense.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for starting a task, streamed or detached.
 *
 * @param prompt           text handed to the agent; must not be blank
 * @param workingDirectory directory the agent runs in; blank means the daemon default
 * @param anthropicApiKey  exported to the agent as {@code ANTHROPIC_API_KEY} when present
 * @param model            exported to the agent as {@code ANTHROPIC_MODEL} when present
 * @param environmentVars  extra environment for the agent process
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecuteRequest(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("working_directory") String workingDirectory,
        @JsonProperty("anthropic_api_key") String anthropicApiKey,
        @JsonProperty("model") String model,
        @JsonProperty("environment_vars") Map<String, String> environmentVars
) {

    public ExecuteRequest {
        environmentVars = environmentVars == null ? Map.of() : Map.copyOf(environmentVars);
    }

    public static ExecuteRequest of(String prompt) {
        return new ExecuteRequest(prompt, null, null, null, Map.of());
    }

    public boolean hasPrompt() {
        return prompt != null && !prompt.isBlank();
    }
}
