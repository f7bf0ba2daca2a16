package com.codearena.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing executor-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSubmission(String submissionId, String language) {
        MDC.put("submissionId", submissionId);
        MDC.put("language", language);
    }

    public static void setBackend(String backend) {
        MDC.put("backend", backend);
    }

    public static void clear() {
        MDC.remove("submissionId");
        MDC.remove("language");
        MDC.remove("backend");
    }
}
