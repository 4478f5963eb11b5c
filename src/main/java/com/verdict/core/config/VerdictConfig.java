package com.verdict.core.config;

import com.verdict.core.clock.ExampleClock;
import com.verdict.core.description.DescriptionSource;
import com.verdict.core.description.RecordingDescriptionSource;
import com.verdict.core.example.ExampleEnvironment;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VerdictConfig {

    @Bean
    @ConditionalOnMissingBean
    public ExampleClock exampleClock() {
        return ExampleClock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public DescriptionSource descriptionSource() {
        return new RecordingDescriptionSource();
    }

    /**
     * Environment for example groups declared as beans; shares the live properties so
     * command-line overrides (e.g. dry run) reach every group.
     */
    @Bean
    public ExampleEnvironment exampleEnvironment(VerdictProperties properties, ExampleClock clock,
                                                 DescriptionSource descriptionSource) {
        return new ExampleEnvironment(properties, clock, descriptionSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
