package com.dispense.sandbox;

import java.util.Map;

/**
 * A sandbox as reported by its provider.
 *
 * @param id       provider-specific identifier (container id, remote sandbox id)
 * @param name     user-facing name from the {@code dispense.name} label
 * @param type     which provider owns it
 * @param state    provider-reported state, e.g. "running" or "started"
 * @param metadata provider-specific extras
 */
public record SandboxInfo(
        String id,
        String name,
        SandboxType type,
        String state,
        Map<String, String> metadata
) {
    public SandboxInfo {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean matches(String nameOrId) {
        return nameOrId != null && (nameOrId.equals(name) || nameOrId.equals(id));
    }

    public String metadata(String key) {
        return metadata.get(key);
    }
}
