package com.dispense.locator;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.core.logging.MdcContext;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.sandbox.SandboxDirectory;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.sandbox.SandboxProvider;
import com.dispense.tunnel.DaemonEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Turns a sandbox name or id into a usable daemon endpoint.
 * <p>
 * Local sandboxes resolve to their container address. Remote sandboxes get a fresh tunnel;
 * the returned endpoint owns it, so callers must close the endpoint when done, typically
 * with try-with-resources.
 */
@Service
public class DaemonLocator {

    private static final Logger log = LoggerFactory.getLogger(DaemonLocator.class);

    private final SandboxDirectory directory;
    private final DispenseMetrics metrics;

    public DaemonLocator(SandboxDirectory directory, @Autowired(required = false) DispenseMetrics metrics) {
        this.directory = directory;
        this.metrics = metrics;
    }

    public DaemonEndpoint resolve(String sandboxNameOrId) {
        SandboxInfo sandbox = directory.find(sandboxNameOrId);
        return connect(sandbox);
    }

    public DaemonEndpoint connect(SandboxInfo sandbox) {
        MdcContext.setSandbox(sandbox.id());
        SandboxProvider provider = directory.providerFor(sandbox);
        String kind = provider.type().name().toLowerCase(Locale.ROOT);
        try {
            DaemonEndpoint endpoint = provider.getConnection(sandbox);
            log.debug("Resolved daemon for sandbox {} at {}", sandbox.name(), endpoint);
            record(kind, true);
            return endpoint;
        } catch (DispenseException e) {
            record(kind, false);
            throw e;
        }
    }

    /** Looks a sandbox up without connecting to it. */
    public SandboxInfo lookup(String sandboxNameOrId) {
        return directory.find(sandboxNameOrId);
    }

    /**
     * Sandboxes whose {@code group} metadata equals {@code group}, across all reachable providers.
     *
     * @throws DispenseException with {@code SANDBOX_NOT_FOUND} when the group is empty
     */
    public List<SandboxInfo> lookupGroup(String group) {
        List<SandboxInfo> members = directory.listAll().stream()
                .filter(sandbox -> group.equals(sandbox.metadata("group")))
                .toList();
        if (members.isEmpty()) {
            throw new DispenseException(ErrorCode.SANDBOX_NOT_FOUND, "No sandboxes found in group: " + group);
        }
        log.debug("Group {} has {} sandbox(es)", group, members.size());
        return members;
    }

    public String workDir(SandboxInfo sandbox) {
        return directory.providerFor(sandbox).getWorkDir(sandbox);
    }

    public SandboxProvider provider(SandboxInfo sandbox) {
        return directory.providerFor(sandbox);
    }

    private void record(String kind, boolean success) {
        if (metrics != null) {
            metrics.recordConnection(kind, success);
        }
    }
}
