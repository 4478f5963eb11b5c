package com.verdict.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for example execution.
 */
@Service
public class VerdictMetrics {

    private final MeterRegistry registry;

    public VerdictMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExampleResult(String status, Duration runTime) {
        Counter.builder("verdict.examples.total")
                .tag("status", status)
                .register(registry)
                .increment();
        if (runTime != null) {
            Timer.builder("verdict.example.duration")
                    .tag("status", status)
                    .register(registry)
                    .record(runTime);
        }
    }

    /**
     * Diagnostics written for failures that were not the reported result of their example.
     */
    public void incrementMessages() {
        Counter.builder("verdict.messages.total")
                .description("Diagnostic messages written during example runs")
                .register(registry)
                .increment();
    }

    public void incrementDeprecations() {
        Counter.builder("verdict.deprecations.total")
                .register(registry)
                .increment();
    }

    public void recordRunDuration(Duration duration) {
        Timer.builder("verdict.run.duration")
                .register(registry)
                .record(duration);
    }
}
