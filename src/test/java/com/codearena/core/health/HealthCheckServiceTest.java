package com.codearena.core.health;

import com.codearena.runner.NativeGoBackend;
import com.codearena.sandbox.SandboxProperties;
import com.codearena.sandbox.SandboxProvider;
import com.codearena.sandbox.StagingArea;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private SandboxProperties properties;
    private StagingArea stagingArea;

    @BeforeEach
    void setUp() {
        properties = new SandboxProperties();
        stagingArea = new StagingArea(tempDir.resolve("staging"));
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream()
                .filter(s -> component.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns docker, go-toolchain, staging components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, stagingArea, properties);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("docker", "go-toolchain", "staging"), components);
    }

    @Test
    @DisplayName("No provider -> docker DOWN")
    void noProviderDockerDown() {
        var service = new HealthCheckService(null, null, stagingArea, properties);

        assertEquals(HealthStatus.Status.DOWN, find(service.checkAll(), "docker").status());
    }

    @Test
    @DisplayName("Reachable daemon -> docker UP")
    void reachableDaemonUp() {
        var provider = mock(SandboxProvider.class);
        when(provider.isReachable()).thenReturn(true);
        var service = new HealthCheckService(provider, null, stagingArea, properties);

        assertEquals(HealthStatus.Status.UP, find(service.checkAll(), "docker").status());
    }

    @Test
    @DisplayName("Ping failure -> docker DOWN with message")
    void pingFailureDown() {
        var provider = mock(SandboxProvider.class);
        when(provider.isReachable()).thenThrow(new RuntimeException("connection refused"));
        var service = new HealthCheckService(provider, null, stagingArea, properties);

        var docker = find(service.checkAll(), "docker");
        assertEquals(HealthStatus.Status.DOWN, docker.status());
        assertTrue(docker.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("Native Go disabled -> go-toolchain UP without probing")
    void nativeDisabledUp() {
        var backend = mock(NativeGoBackend.class);
        var service = new HealthCheckService(null, backend, stagingArea, properties);

        var go = find(service.checkAll(), "go-toolchain");
        assertEquals(HealthStatus.Status.UP, go.status());
        assertEquals("false", go.metadata().get("enabled"));
        verify(backend, never()).isAvailable();
    }

    @Test
    @DisplayName("Native Go enabled but missing -> go-toolchain DEGRADED")
    void nativeMissingDegraded() {
        properties.getExecutor().setUseNativeGo(true);
        var backend = mock(NativeGoBackend.class);
        when(backend.isAvailable()).thenReturn(false);
        var service = new HealthCheckService(null, backend, stagingArea, properties);

        assertEquals(HealthStatus.Status.DEGRADED, find(service.checkAll(), "go-toolchain").status());
    }

    @Test
    @DisplayName("Native Go enabled and present -> go-toolchain UP")
    void nativePresentUp() {
        properties.getExecutor().setUseNativeGo(true);
        var backend = mock(NativeGoBackend.class);
        when(backend.isAvailable()).thenReturn(true);
        var service = new HealthCheckService(null, backend, stagingArea, properties);

        assertEquals(HealthStatus.Status.UP, find(service.checkAll(), "go-toolchain").status());
    }

    @Test
    @DisplayName("Staging directory is created on demand -> staging UP")
    void stagingUp() {
        var service = new HealthCheckService(null, null, stagingArea, properties);

        var staging = find(service.checkAll(), "staging");
        assertEquals(HealthStatus.Status.UP, staging.status());
        assertEquals(stagingArea.root().toString(), staging.metadata().get("path"));
    }
}
