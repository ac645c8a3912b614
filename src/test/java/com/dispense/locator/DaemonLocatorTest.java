package com.dispense.locator;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.sandbox.SandboxDirectory;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.sandbox.SandboxProvider;
import com.dispense.sandbox.SandboxType;
import com.dispense.tunnel.DaemonEndpoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DaemonLocatorTest {

    private SandboxProvider local;
    private SandboxProvider remote;
    private SimpleMeterRegistry registry;
    private DaemonLocator locator;

    private final SandboxInfo localBox = new SandboxInfo("c1", "box", SandboxType.LOCAL, "running", Map.of());
    private final SandboxInfo remoteBox = new SandboxInfo("r1", "cloud", SandboxType.REMOTE, "started", Map.of());

    @BeforeEach
    void setUp() {
        local = mock(SandboxProvider.class);
        remote = mock(SandboxProvider.class);
        when(local.type()).thenReturn(SandboxType.LOCAL);
        when(remote.type()).thenReturn(SandboxType.REMOTE);
        when(local.find("box")).thenReturn(Optional.of(localBox));
        when(local.find("cloud")).thenReturn(Optional.empty());
        when(remote.find("cloud")).thenReturn(Optional.of(remoteBox));
        registry = new SimpleMeterRegistry();
        locator = new DaemonLocator(new SandboxDirectory(List.of(local, remote)), new DispenseMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void localSandboxResolvesDirectly() {
        when(local.getConnection(localBox)).thenReturn(DaemonEndpoint.direct("172.17.0.2", 28080));

        try (DaemonEndpoint endpoint = locator.resolve("box")) {
            assertEquals("172.17.0.2:28080", endpoint.address());
            assertFalse(endpoint.isTunneled());
        }
        assertEquals("c1", MDC.get("sandboxId"));
        assertEquals(1.0, registry.find("dispense.connections").tag("kind", "local").tag("success", "true")
                .counter().count());
    }

    @Test
    void remoteEndpointOwnsItsTunnel() {
        Runnable release = mock(Runnable.class);
        when(remote.getConnection(remoteBox)).thenReturn(DaemonEndpoint.tunneled("127.0.0.1", 41234, release));

        try (DaemonEndpoint endpoint = locator.resolve("cloud")) {
            assertTrue(endpoint.isTunneled());
            assertEquals(41234, endpoint.port());
            verifyNoInteractions(release);
        }
        verify(release, times(1)).run();
    }

    @Test
    void failedConnectionIsCountedAndRethrown() {
        when(remote.getConnection(remoteBox))
                .thenThrow(new DispenseException(ErrorCode.TUNNEL_FAILED, "relay refused"));

        var e = assertThrows(DispenseException.class, () -> locator.resolve("cloud"));
        assertEquals(ErrorCode.TUNNEL_FAILED, e.code());
        assertEquals(1.0, registry.find("dispense.connections").tag("kind", "remote").tag("success", "false")
                .counter().count());
    }

    @Test
    void unknownSandboxIsNotFound() {
        when(local.find("ghost")).thenReturn(Optional.empty());
        when(remote.find("ghost")).thenReturn(Optional.empty());

        var e = assertThrows(DispenseException.class, () -> locator.resolve("ghost"));
        assertEquals(ErrorCode.SANDBOX_NOT_FOUND, e.code());
    }

    @Test
    void workDirAndProviderComeFromOwningProvider() {
        when(remote.getWorkDir(remoteBox)).thenReturn("/home/daytona/workspace");

        assertEquals("/home/daytona/workspace", locator.workDir(remoteBox));
        assertSame(remote, locator.provider(remoteBox));
        assertSame(localBox, locator.lookup("box"));
    }

    @Test
    void groupCollectsMembersAcrossProviders() {
        var api = new SandboxInfo("c2", "api", SandboxType.LOCAL, "running", Map.of("group", "backend"));
        var web = new SandboxInfo("c3", "web", SandboxType.LOCAL, "running", Map.of("group", "frontend"));
        var worker = new SandboxInfo("r2", "worker", SandboxType.REMOTE, "started", Map.of("group", "backend"));
        when(local.list()).thenReturn(List.of(localBox, api, web));
        when(remote.list()).thenReturn(List.of(worker));

        assertEquals(List.of(api, worker), locator.lookupGroup("backend"));
    }

    @Test
    void emptyGroupIsNotFound() {
        when(local.list()).thenReturn(List.of(localBox));
        when(remote.list()).thenThrow(new DispenseException(ErrorCode.PROVIDER_UNAVAILABLE, "no API key"));

        var e = assertThrows(DispenseException.class, () -> locator.lookupGroup("backend"));
        assertEquals(ErrorCode.SANDBOX_NOT_FOUND, e.code());
        assertEquals("No sandboxes found in group: backend", e.getMessage());
    }
}
