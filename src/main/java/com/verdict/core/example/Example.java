package com.verdict.core.example;

import com.verdict.core.clock.ExampleClock;
import com.verdict.core.config.RunConfiguration;
import com.verdict.core.group.ExampleGroup;
import com.verdict.core.hooks.AroundHook;
import com.verdict.core.hooks.HookPhase;
import com.verdict.core.hooks.HookRegistry;
import com.verdict.core.hooks.HookScope;
import com.verdict.core.logging.MdcContext;
import com.verdict.core.metadata.ExampleMetadata;
import com.verdict.core.metadata.SourceLocation;
import com.verdict.core.pending.PendingExampleFixedError;
import com.verdict.core.pending.PendingPolicy;
import com.verdict.core.pending.SkipDeclaredInExample;
import com.verdict.core.reporter.Reporter;
import com.verdict.core.warnings.Warnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One declared example and the lifecycle of running it.
 * <p>
 * A run binds a fresh {@link ExampleContext}, runs the around, before and after hooks of
 * the example's group with the body in the middle, and reports exactly one terminal status.
 * Only the first failure is reported; failures arriving after it are written to the
 * reporter's message channel.
 *
 * <pre>
 * group.before(HookScope.EACH, context -&gt; log.info(context.example().description()));
 * group.around((context, example) -&gt; {
 *     log.info("starting {}", example.metadata().description());
 *     example.run();
 * });
 * </pre>
 */
public class Example {

    private static final Logger log = LoggerFactory.getLogger(Example.class);

    public static final String AFTER_EACH_CONTEXT = "in an after(:each) hook";
    static final String AROUND_EACH_CONTEXT = "in an around(:each) hook";
    static final String DESCRIPTION_CONTEXT = "while assigning the example description";

    private final ExampleGroup group;
    private final ExampleMetadata metadata;
    private final Map<String, Object> options;
    private final ExampleBody body;
    private final ExampleEnvironment environment;
    private ExampleClock clock;
    private List<AroundHook> aroundEachHooks;

    private ExampleContext context;
    private Reporter reporter;
    private Throwable exception;

    public Example(ExampleGroup group, String description, Map<String, Object> options,
                   SourceLocation location, ExampleBody body) {
        this.group = group;
        this.options = Map.copyOf(options);
        this.body = body;
        this.environment = group.environment();
        this.clock = environment.clock();
        this.metadata = group.metadata().forExample(description, options, location);
    }

    // -- Accessors ------------------------------------------------------------

    /**
     * The declared description; examples declared without one are named after the last
     * matcher they ran, or their location when there is none.
     */
    public String description() {
        String description = metadata.description();
        if (description.isEmpty()) {
            description = "example at " + location();
        }
        return configuration().formatDescription(description);
    }

    public String id() { return location().toString(); }
    public SourceLocation sourceLocation() { return metadata.location(); }
    public SourceLocation location() { return metadata.location(); }
    public String filePath() { return metadata.filePath(); }
    public String fullDescription() { return metadata.fullDescription(); }
    public ExecutionResult executionResult() { return metadata.executionResult(); }
    public boolean isPending() { return metadata.isPending(); }
    public boolean isSkipped() { return metadata.isSkip(); }
    public ExampleMetadata metadata() { return metadata; }
    public ExampleGroup exampleGroup() { return group; }
    public ExampleClock clock() { return clock; }
    public void setClock(ExampleClock clock) { this.clock = clock; }

    /**
     * The options the example was declared with.
     *
     * @deprecated read them through {@link #metadata()} instead
     */
    @Deprecated
    public Map<String, Object> options() {
        warnings().deprecate("Example#options", Map.of("replacement", "Example#metadata"));
        return options;
    }

    /**
     * Warnings reported through the reporter of the run in progress.
     */
    public Warnings warnings() {
        return new Warnings(reporter);
    }

    /** The first failure captured while running this example, or {@code null}. */
    public Throwable exception() { return exception; }

    /** The context of the run in progress, {@code null} outside a run. */
    public ExampleContext context() { return context; }

    // -- Running --------------------------------------------------------------

    /**
     * Runs the example in {@code context} and reports its progress to {@code reporter}.
     * Results of an earlier run of this example are discarded first.
     *
     * @return false if the example failed, true if it passed or is pending
     */
    public boolean run(ExampleContext context, Reporter reporter) {
        resetForRun();
        this.context = context;
        context.bind(this);
        CurrentExample.set(this);
        MdcContext.setExample(id(), fullDescription());
        try {
            start(reporter);
            try {
                if (isSkipped()) {
                    PendingPolicy.markSkipped(this, metadata.skipMessage());
                } else if (!configuration().dryRun()) {
                    runWithAroundEachHooks();
                }
            } catch (Throwable e) {
                Failures.rethrowIfUnrecoverable(e);
                captureFailure(e);
            } finally {
                context.clearLocalState();
                this.context = null;
                try {
                    assignGeneratedDescription();
                } catch (Throwable e) {
                    Failures.rethrowIfUnrecoverable(e);
                    captureFailure(e, DESCRIPTION_CONTEXT);
                }
            }
            return finish(reporter);
        } finally {
            CurrentExample.clear();
            MdcContext.clearExample();
        }
    }

    /**
     * Reports this example as failed with {@code failure} without running any of its hooks
     * or its body, e.g. when a group-level before hook failed.
     */
    public boolean failWithException(Reporter reporter, Throwable failure) {
        resetForRun();
        start(reporter);
        captureFailure(failure);
        return finish(reporter);
    }

    // -- Failure capture ------------------------------------------------------

    public void captureFailure(Throwable failure) {
        captureFailure(failure, null);
    }

    /**
     * Keeps {@code failure} as the example's failure unless one was captured already, in
     * which case it is written to the reporter's message channel tagged with {@code context}.
     */
    public void captureFailure(Throwable failure, String context) {
        if (exception != null) {
            String message = Failures.diagnostic(failure, context);
            log.debug("Example {} already failed, not reporting {}", id(), failure.toString());
            if (reporter != null) {
                reporter.message(message);
            } else {
                log.warn(message);
            }
            return;
        }
        exception = failure;
    }

    /**
     * Like {@link #captureFailure(Throwable)}, without the diagnostic when a failure
     * was captured already.
     */
    public void captureFailureQuietly(Throwable failure) {
        if (exception == null) {
            exception = failure;
        }
    }

    // -- Pipeline -------------------------------------------------------------

    private void runWithAroundEachHooks() {
        try {
            if (aroundEachHooks().isEmpty()) {
                runGuardedPipeline();
            } else {
                hooks().runAround(this, new Procsy(metadata, this::runGuardedPipeline));
            }
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            captureFailure(e, AROUND_EACH_CONTEXT);
        }
    }

    private void runGuardedPipeline() throws Exception {
        try {
            record(runBeforeEachAndBody());
        } finally {
            runAfterEach();
        }
    }

    private Outcome runBeforeEachAndBody() {
        try {
            context.mocks().setupMocks();
            hooks().run(HookPhase.BEFORE, HookScope.EACH, this);
            body.run(context);
        } catch (SkipDeclaredInExample e) {
            return Outcome.skippedNow();
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            return Outcome.failed(e);
        }
        if (isPending()) {
            PendingExampleFixedError fixed = PendingPolicy.markFixed(this);
            return Outcome.pendingFixed(fixed);
        }
        return Outcome.passed();
    }

    private void record(Outcome outcome) {
        switch (outcome.kind()) {
            case FAILED -> {
                if (isPending()) {
                    executionResult().setPendingException(outcome.error());
                } else {
                    captureFailure(outcome.error());
                }
            }
            case PENDING_FIXED -> captureFailure(outcome.error());
            case PASSED, SKIPPED_NOW -> { }
        }
    }

    private void runAfterEach() throws Exception {
        try {
            hooks().run(HookPhase.AFTER, HookScope.EACH, this);
            verifyMocks();
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            captureFailure(e, AFTER_EACH_CONTEXT);
        } finally {
            context.mocks().teardownMocks();
        }
    }

    // A recorded pending message takes precedence over unmet mock expectations.
    private void verifyMocks() {
        try {
            context.mocks().verifyMocks();
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            if (executionResult().pendingMessage() != null) {
                executionResult().setPendingFixed(false);
                metadata.setPending(true);
                exception = null;
            } else {
                captureFailureQuietly(e);
            }
        }
    }

    private void assignGeneratedDescription() {
        if (!configuration().expectingMatcherDescriptions()) {
            return;
        }
        var source = environment.descriptionSource();
        if (metadata.descriptionArgs().isEmpty()) {
            String generated = source.lastGeneratedDescription();
            if (generated != null) {
                metadata.addDescriptionArg(generated);
            }
        }
        source.clear();
    }

    // -- Start / finish -------------------------------------------------------

    // An example may run more than once, e.g. when a suite is run again.
    private void resetForRun() {
        metadata.resetForRun();
        exception = null;
        aroundEachHooks = null;
    }

    private void start(Reporter reporter) {
        this.reporter = reporter;
        log.debug("Starting example {} ({})", id(), fullDescription());
        reporter.exampleStarted(this);
        executionResult().start(clock.now());
    }

    private boolean finish(Reporter reporter) {
        String pendingMessage = executionResult().pendingMessage();
        try {
            if (exception != null) {
                recordFinished(ExampleStatus.FAILED);
                executionResult().setException(exception);
                reporter.exampleFailed(this);
                return false;
            } else if (pendingMessage != null) {
                recordFinished(ExampleStatus.PENDING);
                reporter.examplePending(this);
                return true;
            } else {
                recordFinished(ExampleStatus.PASSED);
                reporter.examplePassed(this);
                return true;
            }
        } finally {
            this.reporter = null;
        }
    }

    private void recordFinished(ExampleStatus status) {
        Instant finishedAt = clock.now();
        executionResult().finish(status, finishedAt);
        log.debug("Example {} finished {} in {} ms", id(), status,
                executionResult().runTime().toMillis());
    }

    private List<AroundHook> aroundEachHooks() {
        if (aroundEachHooks == null) {
            aroundEachHooks = hooks().aroundHooksFor(this);
        }
        return aroundEachHooks;
    }

    private HookRegistry hooks() {
        return group.hooks();
    }

    private RunConfiguration configuration() {
        return environment.configuration();
    }

    @Override
    public String toString() {
        return "Example{" + fullDescription() + " @ " + location() + "}";
    }
}
