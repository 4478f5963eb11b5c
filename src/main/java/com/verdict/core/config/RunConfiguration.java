package com.verdict.core.config;

/**
 * Run-wide settings consulted while executing examples.
 */
public interface RunConfiguration {

    /** When true, examples are reported without running hooks or bodies. */
    boolean dryRun();

    /** When true, examples without a description are named from the last matcher description. */
    boolean expectingMatcherDescriptions();

    String formatDescription(String description);
}
