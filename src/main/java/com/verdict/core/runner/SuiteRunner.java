package com.verdict.core.runner;

import com.verdict.core.clock.ExampleClock;
import com.verdict.core.config.VerdictProperties;
import com.verdict.core.events.EventBus;
import com.verdict.core.events.VerdictEvent;
import com.verdict.core.example.Example;
import com.verdict.core.group.ExampleGroup;
import com.verdict.core.logging.MdcContext;
import com.verdict.core.metrics.VerdictMetrics;
import com.verdict.core.reporter.PublishingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a set of example groups as one run, reporting through a {@link PublishingReporter}.
 */
@Service
public class SuiteRunner {

    private static final Logger log = LoggerFactory.getLogger(SuiteRunner.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final EventBus eventBus;
    private final VerdictMetrics metrics;
    private final ExampleClock clock;
    private final VerdictProperties properties;
    private final ExampleGroupRunner groupRunner = new ExampleGroupRunner();

    public SuiteRunner(EventBus eventBus, VerdictMetrics metrics, ExampleClock clock, VerdictProperties properties) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.properties = properties;
    }

    public SuiteSummary run(List<ExampleGroup> groups) {
        return run(generateRunId(), groups);
    }

    public SuiteSummary run(String runId, List<ExampleGroup> groups) {
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} with {} group(s), dryRun={}, subscribers={}", runId, groups.size(),
                    properties.dryRun(), eventBus.subscriberCount(runId));
            Instant startedAt = clock.now();
            eventBus.publish(new VerdictEvent("run.started", runId, null,
                    Map.of("groups", groups.size(), "dryRun", properties.dryRun()), startedAt));

            var reporter = new PublishingReporter(eventBus, metrics, clock, runId);
            var examples = new ArrayList<Example>();
            for (ExampleGroup group : groups) {
                groupRunner.run(group, reporter);
                examples.addAll(group.descendantExamples());
            }

            Duration duration = Duration.between(startedAt, clock.now());
            metrics.recordRunDuration(duration);
            SuiteSummary summary = SuiteSummary.of(runId, examples, duration);
            eventBus.publish(new VerdictEvent("run.finished", runId, null,
                    Map.of("examples", summary.examples(), "failures", summary.failures(),
                            "pending", summary.pending()), clock.now()));
            log.info("Finished run {} in {} ms: {}", runId, duration.toMillis(), summary);
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique run ID in the format PREFIX-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("%s-%d-%04d", properties.getRunIdPrefix(), year, count);
    }
}
