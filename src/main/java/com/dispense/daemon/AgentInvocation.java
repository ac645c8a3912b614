package com.dispense.daemon;

import com.dispense.protocol.ExecuteRequest;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the agent subprocess: configured executable and arguments, the prompt last,
 * the task's working directory, and the inherited environment plus the request's extras.
 */
public class AgentInvocation {

    static final String API_KEY_ENV = "ANTHROPIC_API_KEY";
    static final String MODEL_ENV = "ANTHROPIC_MODEL";

    private final DaemonProperties.Agent agent;

    public AgentInvocation(DaemonProperties.Agent agent) {
        this.agent = agent;
    }

    public List<String> command(String prompt) {
        List<String> command = new ArrayList<>();
        command.add(agent.getExecutable());
        command.addAll(agent.getArguments());
        command.add(prompt);
        return command;
    }

    public ProcessBuilder processBuilder(ExecuteRequest request, String workingDirectory) {
        ProcessBuilder pb = new ProcessBuilder(command(request.prompt()));
        pb.directory(new File(workingDirectory));
        Map<String, String> env = pb.environment();
        if (request.anthropicApiKey() != null && !request.anthropicApiKey().isBlank()) {
            env.put(API_KEY_ENV, request.anthropicApiKey());
        }
        if (request.model() != null && !request.model().isBlank()) {
            env.put(MODEL_ENV, request.model());
        }
        env.putAll(request.environmentVars());
        return pb;
    }

    public String executable() {
        return agent.getExecutable();
    }
}
