package com.verdict.core.example;

/**
 * Lifecycle status of a single example run.
 */
public enum ExampleStatus {
    NOT_STARTED,
    STARTED,
    PASSED,
    FAILED,
    PENDING;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == PENDING;
    }
}
