package com.verdict.core.example;

import com.verdict.core.clock.ExampleClock;
import com.verdict.core.config.RunConfiguration;
import com.verdict.core.config.VerdictProperties;
import com.verdict.core.description.DescriptionSource;
import com.verdict.core.description.RecordingDescriptionSource;

/**
 * Collaborators shared by every example declared under a group tree.
 *
 * @param configuration     run-wide settings (dry run, description handling)
 * @param clock             time source for run timestamps
 * @param descriptionSource last generated matcher description, for undescribed examples
 */
public record ExampleEnvironment(
    RunConfiguration configuration,
    ExampleClock clock,
    DescriptionSource descriptionSource
) {

    public static ExampleEnvironment defaults() {
        return new ExampleEnvironment(new VerdictProperties(), ExampleClock.system(),
                new RecordingDescriptionSource());
    }

    public ExampleEnvironment withClock(ExampleClock clock) {
        return new ExampleEnvironment(configuration, clock, descriptionSource);
    }

    public ExampleEnvironment withConfiguration(RunConfiguration configuration) {
        return new ExampleEnvironment(configuration, clock, descriptionSource);
    }
}
