package com.dispense.sandbox;

import com.dispense.core.error.DispenseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds sandboxes by name or id across providers, local first, then remote.
 * A provider that cannot be reached (no Docker socket, no API key) is skipped.
 */
public class SandboxDirectory {

    private static final Logger log = LoggerFactory.getLogger(SandboxDirectory.class);

    private final List<SandboxProvider> providers;

    public SandboxDirectory(List<SandboxProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    /**
     * @throws DispenseException with {@code SANDBOX_NOT_FOUND} when no provider knows the sandbox
     */
    public SandboxInfo find(String nameOrId) {
        for (SandboxProvider provider : providers) {
            try {
                var match = provider.find(nameOrId);
                if (match.isPresent()) {
                    log.debug("Sandbox {} found in {} provider", nameOrId, provider.type());
                    return match.get();
                }
            } catch (DispenseException e) {
                log.debug("Skipping {} provider while looking up {}: {}", provider.type(), nameOrId, e.getMessage());
            }
        }
        throw DispenseException.sandboxNotFound(nameOrId);
    }

    public SandboxProvider providerFor(SandboxInfo sandbox) {
        return providerFor(sandbox.type());
    }

    public SandboxProvider providerFor(SandboxType type) {
        return providers.stream()
                .filter(p -> p.type() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No provider registered for " + type));
    }

    /** Every sandbox from every reachable provider. */
    public List<SandboxInfo> listAll() {
        var all = new ArrayList<SandboxInfo>();
        for (SandboxProvider provider : providers) {
            try {
                all.addAll(provider.list());
            } catch (DispenseException e) {
                log.debug("Skipping {} provider in listing: {}", provider.type(), e.getMessage());
            }
        }
        return all;
    }
}
