package com.codearena.runner;

import com.codearena.core.model.SubmissionResult;

import java.util.Locale;

/**
 * Which compiled backend produced a result, and why.
 */
public record BackendOutcome(Backend backend, FallbackReason fallbackReason, SubmissionResult result) {

    public enum Backend {
        NATIVE, CONTAINER;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum FallbackReason {
        /** The native backend served the request. */
        NONE,
        /** Native execution is switched off by configuration. */
        DISABLED,
        /** The toolchain probe failed. */
        UNAVAILABLE,
        /** The native backend threw. */
        NATIVE_FAILED;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
