package com.verdict.dispatch.cli;

import com.verdict.core.config.VerdictProperties;
import com.verdict.core.events.EventBus;
import com.verdict.core.group.ExampleGroup;
import com.verdict.core.runner.SuiteRunner;
import com.verdict.core.runner.SuiteSummary;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: verdict run
 * <p>
 * Runs every {@link ExampleGroup} bean, printing failures and diagnostics as the run
 * publishes them, and exits with 1 when an example failed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run all registered example groups")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = "--dry-run", description = "Report examples without running hooks or bodies")
    private boolean dryRun;

    @Option(names = "--run-id", description = "Run ID to use instead of a generated one")
    private String runId;

    private final SuiteRunner suiteRunner;
    private final EventBus eventBus;
    private final ObjectProvider<ExampleGroup> groups;
    private final VerdictProperties properties;

    public RunCommand(SuiteRunner suiteRunner, EventBus eventBus, ObjectProvider<ExampleGroup> groups,
                      VerdictProperties properties) {
        this.suiteRunner = suiteRunner;
        this.eventBus = eventBus;
        this.groups = groups;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (dryRun) {
            properties.setDryRun(true);
        }
        List<ExampleGroup> toRun = groups.orderedStream().collect(Collectors.toList());
        if (toRun.isEmpty()) {
            ConsoleOutput.info("No example groups registered");
            return 0;
        }
        ConsoleOutput.info("Running " + toRun.size() + " example group" + (toRun.size() != 1 ? "s" : "")
                + (properties.dryRun() ? " (dry run)" : ""));

        String id = runId != null ? runId : suiteRunner.generateRunId();
        EventBus.Subscription subscription = eventBus.subscribe(id, ConsoleOutput::runEvent);
        SuiteSummary summary;
        try {
            summary = suiteRunner.run(id, toRun);
        } finally {
            subscription.unsubscribe();
        }
        ConsoleOutput.summary(summary);
        return summary.passed() ? 0 : 1;
    }
}
