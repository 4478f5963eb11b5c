package com.verdict.core.pending;

/**
 * Thrown by {@code ExampleContext.skip(...)} to stop the rest of an example body.
 * The skip has already been recorded when this is thrown; it never counts as a failure.
 */
public class SkipDeclaredInExample extends RuntimeException {

    public SkipDeclaredInExample(String reason) {
        super(reason, null, false, false);
    }
}
