package com.codearena.runner;

import com.codearena.core.model.ExecutionRequest;
import com.codearena.runner.BackendOutcome.Backend;
import com.codearena.runner.BackendOutcome.FallbackReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the native backend when enabled and available, and falls back to the
 * container backend otherwise or when native execution throws.
 */
public class NativeThenContainer {

    private static final Logger log = LoggerFactory.getLogger(NativeThenContainer.class);

    private final CompiledBackend nativeBackend;
    private final CompiledBackend containerBackend;
    private final boolean preferNative;

    public NativeThenContainer(CompiledBackend nativeBackend, CompiledBackend containerBackend,
                               boolean preferNative) {
        this.nativeBackend = nativeBackend;
        this.containerBackend = containerBackend;
        this.preferNative = preferNative;
    }

    public BackendOutcome execute(ExecutionRequest request) {
        if (!preferNative) {
            return viaContainer(request, FallbackReason.DISABLED);
        }
        try {
            if (!nativeBackend.isAvailable()) {
                log.info("Native Go toolchain not available, using container");
                return viaContainer(request, FallbackReason.UNAVAILABLE);
            }
            return new BackendOutcome(Backend.NATIVE, FallbackReason.NONE, nativeBackend.execute(request));
        } catch (RuntimeException e) {
            log.warn("Native Go execution failed, falling back to container: {}", e.getMessage(), e);
            return viaContainer(request, FallbackReason.NATIVE_FAILED);
        }
    }

    private BackendOutcome viaContainer(ExecutionRequest request, FallbackReason reason) {
        return new BackendOutcome(Backend.CONTAINER, reason, containerBackend.execute(request));
    }
}
