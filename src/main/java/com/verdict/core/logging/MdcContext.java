package com.verdict.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Verdict-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setExample(String exampleId, String fullDescription) {
        MDC.put("exampleId", exampleId);
        MDC.put("example", fullDescription);
    }

    public static void clearExample() {
        MDC.remove("exampleId");
        MDC.remove("example");
    }

    public static void clear() {
        MDC.remove("runId");
        clearExample();
    }
}
