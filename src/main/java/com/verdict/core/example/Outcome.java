package com.verdict.core.example;

/**
 * What running the before hooks and body of an example produced, before it is recorded.
 */
record Outcome(Kind kind, Throwable error) {

    enum Kind {
        PASSED,
        FAILED,
        SKIPPED_NOW,
        PENDING_FIXED
    }

    private static final Outcome PASSED = new Outcome(Kind.PASSED, null);
    private static final Outcome SKIPPED_NOW = new Outcome(Kind.SKIPPED_NOW, null);

    static Outcome passed() { return PASSED; }
    static Outcome skippedNow() { return SKIPPED_NOW; }
    static Outcome failed(Throwable error) { return new Outcome(Kind.FAILED, error); }
    static Outcome pendingFixed(Throwable error) { return new Outcome(Kind.PENDING_FIXED, error); }
}
