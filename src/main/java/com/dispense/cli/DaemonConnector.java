package com.dispense.cli;

import com.dispense.client.DaemonClient;
import com.dispense.locator.DaemonLocator;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.sandbox.SandboxProvider;
import com.dispense.tunnel.DaemonEndpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Opens {@link DaemonSession}s for the CLI commands.
 */
@Component
public class DaemonConnector {

    private final DaemonLocator locator;
    private final ObjectMapper objectMapper;
    private final ControllerProperties properties;

    public DaemonConnector(DaemonLocator locator, ObjectMapper objectMapper, ControllerProperties properties) {
        this.locator = locator;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    DaemonSession open(String sandboxNameOrId) {
        return open(locator.lookup(sandboxNameOrId));
    }

    DaemonSession open(SandboxInfo sandbox) {
        DaemonEndpoint endpoint = locator.connect(sandbox);
        return new DaemonSession(sandbox, endpoint,
                DaemonClient.connect(endpoint, objectMapper, properties.getRequestTimeout()),
                DaemonClient.connect(endpoint, objectMapper, properties.getStatusTimeout()));
    }

    SandboxInfo lookup(String sandboxNameOrId) {
        return locator.lookup(sandboxNameOrId);
    }

    List<SandboxInfo> lookupGroup(String group) {
        return locator.lookupGroup(group);
    }

    SandboxProvider provider(SandboxInfo sandbox) {
        return locator.provider(sandbox);
    }

    String workDir(SandboxInfo sandbox) {
        return locator.workDir(sandbox);
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    ControllerProperties properties() {
        return properties;
    }
}
