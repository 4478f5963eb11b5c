package com.verdict.core.example;

import java.time.Duration;
import java.time.Instant;

/**
 * Timestamps, status and pending bookkeeping for one run of an example.
 * <p>
 * Status only moves forward: {@code NOT_STARTED -> STARTED -> PASSED | FAILED | PENDING}.
 * {@link #runTime()} is set together with the terminal status. {@link #reset()} starts over
 * for another run of the same example.
 */
public class ExecutionResult {

    private ExampleStatus status = ExampleStatus.NOT_STARTED;
    private Instant startedAt;
    private Instant finishedAt;
    private Duration runTime;
    private String pendingMessage;
    private Boolean pendingFixed;
    private Throwable pendingException;
    private Throwable exception;

    void start(Instant startedAt) {
        if (status != ExampleStatus.NOT_STARTED) {
            throw new IllegalStateException("Cannot start an example run in status " + status);
        }
        this.status = ExampleStatus.STARTED;
        this.startedAt = startedAt;
    }

    void finish(ExampleStatus terminal, Instant finishedAt) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        if (status != ExampleStatus.STARTED) {
            throw new IllegalStateException("Cannot finish an example run in status " + status);
        }
        this.status = terminal;
        this.finishedAt = finishedAt;
        this.runTime = Duration.between(startedAt, finishedAt);
    }

    /**
     * Forgets everything recorded by a previous run, back to {@code NOT_STARTED}.
     */
    public void reset() {
        status = ExampleStatus.NOT_STARTED;
        startedAt = null;
        finishedAt = null;
        runTime = null;
        pendingMessage = null;
        pendingFixed = null;
        pendingException = null;
        exception = null;
    }

    public ExampleStatus status() { return status; }
    public Instant startedAt() { return startedAt; }
    public Instant finishedAt() { return finishedAt; }
    public Duration runTime() { return runTime; }
    public String pendingMessage() { return pendingMessage; }
    public Boolean pendingFixed() { return pendingFixed; }
    public Throwable pendingException() { return pendingException; }

    /** The failure reported for this run, recorded when it finishes as failed. */
    public Throwable exception() { return exception; }

    public void setPendingMessage(String pendingMessage) { this.pendingMessage = pendingMessage; }
    public void setPendingFixed(Boolean pendingFixed) { this.pendingFixed = pendingFixed; }
    public void setPendingException(Throwable pendingException) { this.pendingException = pendingException; }

    void setException(Throwable exception) { this.exception = exception; }

    @Override
    public String toString() {
        return "ExecutionResult{status=" + status + ", runTime=" + runTime
                + ", pendingMessage=" + pendingMessage + "}";
    }
}
