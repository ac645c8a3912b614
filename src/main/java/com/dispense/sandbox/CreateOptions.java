package com.dispense.sandbox;

import java.util.Map;

/**
 * Parameters for creating a sandbox. Null sizing fields fall back to provider defaults.
 */
public record CreateOptions(
        String name,
        String image,
        Integer cpu,
        Integer memoryGb,
        Integer diskGb,
        Integer autoStopMinutes,
        String group,
        Map<String, String> environment
) {
    public CreateOptions {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static CreateOptions named(String name) {
        return new CreateOptions(name, null, null, null, null, null, null, Map.of());
    }
}
