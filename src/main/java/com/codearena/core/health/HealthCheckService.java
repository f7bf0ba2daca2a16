package com.codearena.core.health;

import com.codearena.runner.NativeGoBackend;
import com.codearena.sandbox.SandboxProperties;
import com.codearena.sandbox.SandboxProvider;
import com.codearena.sandbox.StagingArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProvider sandboxProvider;
    private final NativeGoBackend nativeGoBackend;
    private final StagingArea stagingArea;
    private final SandboxProperties properties;

    public HealthCheckService(
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) NativeGoBackend nativeGoBackend,
            StagingArea stagingArea,
            SandboxProperties properties) {
        this.sandboxProvider = sandboxProvider;
        this.nativeGoBackend = nativeGoBackend;
        this.stagingArea = stagingArea;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkGoToolchain());
        results.add(checkStaging());
        return results;
    }

    private HealthStatus checkDocker() {
        if (sandboxProvider == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No SandboxProvider configured", Map.of());
        }
        try {
            if (sandboxProvider.isReachable()) {
                return new HealthStatus("docker", HealthStatus.Status.UP,
                        "Docker daemon reachable", Map.of());
            }
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker daemon not reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    /**
     * The native toolchain is optional: without it compiled submissions still run
     * in containers, so a missing toolchain only degrades the service when it is enabled.
     */
    private HealthStatus checkGoToolchain() {
        var metadata = Map.of(
                "enabled", String.valueOf(properties.isUseNativeGo()),
                "binary", properties.getGoBinary());
        if (!properties.isUseNativeGo()) {
            return new HealthStatus("go-toolchain", HealthStatus.Status.UP,
                    "Native Go execution disabled, compiled submissions run in containers", metadata);
        }
        if (nativeGoBackend != null && nativeGoBackend.isAvailable()) {
            return new HealthStatus("go-toolchain", HealthStatus.Status.UP,
                    "Native Go toolchain available", metadata);
        }
        return new HealthStatus("go-toolchain", HealthStatus.Status.DEGRADED,
                "Native Go toolchain not available, falling back to containers", metadata);
    }

    private HealthStatus checkStaging() {
        var metadata = Map.of("path", stagingArea.root().toString());
        if (stagingArea.isWritable()) {
            return new HealthStatus("staging", HealthStatus.Status.UP,
                    "Staging directory writable", metadata);
        }
        return new HealthStatus("staging", HealthStatus.Status.DOWN,
                "Staging directory not writable", metadata);
    }
}
