package com.verdict.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while running examples.
 *
 * @param eventType event type (e.g. "example.started", "example.failed", "run.message")
 * @param runId     the run this event belongs to
 * @param exampleId the example this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record VerdictEvent(
    String eventType,
    String runId,
    String exampleId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
