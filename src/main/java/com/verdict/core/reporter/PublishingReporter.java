package com.verdict.core.reporter;

import com.verdict.core.clock.ExampleClock;
import com.verdict.core.events.EventBus;
import com.verdict.core.events.VerdictEvent;
import com.verdict.core.example.Example;
import com.verdict.core.example.ExecutionResult;
import com.verdict.core.metrics.VerdictMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link Reporter} publishing every notification on the {@link EventBus} for one run and
 * recording example outcomes in {@link VerdictMetrics}.
 */
public class PublishingReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(PublishingReporter.class);

    private final EventBus eventBus;
    private final VerdictMetrics metrics;
    private final ExampleClock clock;
    private final String runId;

    public PublishingReporter(EventBus eventBus, VerdictMetrics metrics, ExampleClock clock, String runId) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    @Override
    public void exampleStarted(Example example) {
        publishExample("example.started", example, new HashMap<>());
    }

    @Override
    public void examplePassed(Example example) {
        finished("passed", example, new HashMap<>());
    }

    @Override
    public void exampleFailed(Example example) {
        var payload = new HashMap<String, Object>();
        Throwable exception = example.exception();
        if (exception != null) {
            payload.put("exceptionClass", exception.getClass().getName());
            payload.put("exceptionMessage", String.valueOf(exception.getMessage()));
        }
        log.info("Example failed: {} ({})", example.fullDescription(), exception);
        finished("failed", example, payload);
    }

    @Override
    public void examplePending(Example example) {
        var payload = new HashMap<String, Object>();
        payload.put("pendingMessage", example.executionResult().pendingMessage());
        finished("pending", example, payload);
    }

    @Override
    public void message(String message) {
        log.warn("{}", message);
        metrics.incrementMessages();
        eventBus.publish(new VerdictEvent("run.message", runId, null,
                Map.of("message", message), clock.now()));
    }

    @Override
    public void deprecation(Map<String, Object> fields) {
        log.warn("Deprecation: {}", fields);
        metrics.incrementDeprecations();
        eventBus.publish(new VerdictEvent("run.deprecation", runId, null,
                new HashMap<>(fields), clock.now()));
    }

    private void finished(String status, Example example, Map<String, Object> payload) {
        ExecutionResult result = example.executionResult();
        metrics.recordExampleResult(status, result.runTime());
        if (result.runTime() != null) {
            payload.put("runTimeMs", result.runTime().toMillis());
        }
        publishExample("example." + status, example, payload);
    }

    private void publishExample(String eventType, Example example, Map<String, Object> payload) {
        payload.put("description", example.fullDescription());
        payload.put("location", example.location().toString());
        eventBus.publish(new VerdictEvent(eventType, runId, example.id(), payload, clock.now()));
    }
}
