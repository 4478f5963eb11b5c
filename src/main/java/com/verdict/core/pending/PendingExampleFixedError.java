package com.verdict.core.pending;

import com.verdict.core.metadata.SourceLocation;

/**
 * Reported when an example declared pending completes without failing.
 */
public class PendingExampleFixedError extends RuntimeException {

    public static final String MESSAGE = "Expected example to fail since it is pending, but it passed.";

    private final SourceLocation location;

    public PendingExampleFixedError(SourceLocation location) {
        super(MESSAGE);
        this.location = location;
    }

    /** Where the pending example was declared. */
    public SourceLocation location() {
        return location;
    }
}
