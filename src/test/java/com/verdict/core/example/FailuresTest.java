package com.verdict.core.example;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailuresTest {

    @Test
    void diagnosticNamesContextFailureAndFrame() {
        var failure = new IllegalStateException("closed");

        String diagnostic = Failures.diagnostic(failure, "in an after(:all) hook");

        assertTrue(diagnostic.startsWith("\nAn error occurred in an after(:all) hook\n"));
        assertTrue(diagnostic.contains("  java.lang.IllegalStateException: closed\n"));
        assertTrue(diagnostic.contains("  occurred at " + failure.getStackTrace()[0]));
        assertTrue(diagnostic.endsWith("\n\n"));
    }

    @Test
    void firstFrameOfTracelessFailure() {
        var failure = new RuntimeException("no trace", null, false, false) {};

        assertEquals("(no backtrace)", Failures.firstFrame(failure));
    }

    @Test
    void onlyOutOfMemoryIsRethrown() {
        assertDoesNotThrow(() -> Failures.rethrowIfUnrecoverable(new StackOverflowError()));
        assertDoesNotThrow(() -> Failures.rethrowIfUnrecoverable(new AssertionError()));
        assertThrows(OutOfMemoryError.class, () -> Failures.rethrowIfUnrecoverable(new OutOfMemoryError()));
    }
}
