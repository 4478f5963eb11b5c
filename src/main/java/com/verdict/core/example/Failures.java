package com.verdict.core.example;

/**
 * Helpers shared by the places that catch failures raised from examples and hooks.
 */
public final class Failures {

    private Failures() {}

    /**
     * Rethrows failures the engine must not try to record. Everything else, including
     * assertion errors, is an ordinary example failure.
     */
    public static void rethrowIfUnrecoverable(Throwable failure) {
        if (failure instanceof OutOfMemoryError) {
            throw (OutOfMemoryError) failure;
        }
    }

    public static String firstFrame(Throwable failure) {
        StackTraceElement[] trace = failure.getStackTrace();
        return trace.length == 0 ? "(no backtrace)" : trace[0].toString();
    }

    /**
     * Diagnostic text for a failure that is not reported as an example's result, e.g. one
     * arriving after another failure was already captured.
     */
    public static String diagnostic(Throwable failure, String context) {
        return "\nAn error occurred" + (context == null ? "" : " " + context) + "\n"
                + "  " + failure.getClass().getName() + ": " + failure.getMessage() + "\n"
                + "  occurred at " + firstFrame(failure) + "\n\n";
    }
}
