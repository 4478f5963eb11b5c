package com.verdict.core.runner;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleStatus;

import java.time.Duration;
import java.util.List;

/**
 * Counts of one suite run.
 */
public record SuiteSummary(
    String runId,
    int examples,
    int failures,
    int pending,
    Duration duration
) {

    public static SuiteSummary of(String runId, List<Example> examples, Duration duration) {
        int failures = 0;
        int pending = 0;
        for (Example example : examples) {
            ExampleStatus status = example.executionResult().status();
            if (status == ExampleStatus.FAILED) {
                failures++;
            } else if (status == ExampleStatus.PENDING) {
                pending++;
            }
        }
        return new SuiteSummary(runId, examples.size(), failures, pending, duration);
    }

    public boolean passed() {
        return failures == 0;
    }

    @Override
    public String toString() {
        return examples + " example" + (examples != 1 ? "s" : "") + ", "
                + failures + " failure" + (failures != 1 ? "s" : "")
                + (pending > 0 ? ", " + pending + " pending" : "");
    }
}
