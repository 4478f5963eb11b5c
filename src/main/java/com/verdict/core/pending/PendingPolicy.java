package com.verdict.core.pending;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records pending, skipped and fixed states on an example.
 * <p>
 * A pending example is expected to fail: its failures are kept on the execution result
 * instead of being reported, and an unexpected pass is turned into a
 * {@link PendingExampleFixedError}.
 */
public final class PendingPolicy {

    private static final Logger log = LoggerFactory.getLogger(PendingPolicy.class);

    public static final String NO_REASON_GIVEN = "No reason given";

    private PendingPolicy() {}

    public static void markPending(Example example, String reason) {
        String message = reason == null ? NO_REASON_GIVEN : reason;
        log.debug("Marking example {} pending: {}", example.id(), message);
        example.metadata().setPending(true);
        ExecutionResult result = example.executionResult();
        result.setPendingMessage(message);
        result.setPendingFixed(false);
    }

    public static void markSkipped(Example example, String reason) {
        String message = reason == null ? NO_REASON_GIVEN : reason;
        example.metadata().setSkip(true, message);
        markPending(example, message);
    }

    /**
     * Records that a pending example passed. Clears the pending flag so the resulting
     * {@link PendingExampleFixedError} is reported as the example's failure.
     *
     * @return the error to report for the example
     */
    public static PendingExampleFixedError markFixed(Example example) {
        log.debug("Pending example {} passed", example.id());
        example.metadata().setPending(false);
        example.executionResult().setPendingFixed(true);
        return new PendingExampleFixedError(example.location());
    }
}
