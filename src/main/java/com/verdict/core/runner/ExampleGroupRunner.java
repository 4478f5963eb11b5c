package com.verdict.core.runner;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleContext;
import com.verdict.core.example.Failures;
import com.verdict.core.group.ExampleGroup;
import com.verdict.core.hooks.HookPhase;
import com.verdict.core.reporter.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the examples of a group and its nested groups in declaration order.
 * <p>
 * Group-level before hooks run once, and the values they store are copied into the context
 * of every example below the group. When one of them fails, every example below the group
 * is reported failed with that error without being run.
 */
public class ExampleGroupRunner {

    private static final Logger log = LoggerFactory.getLogger(ExampleGroupRunner.class);

    static final String AFTER_ALL_CONTEXT = "in an after(:all) hook";

    /**
     * @return true when no example of the group tree failed
     */
    public boolean run(ExampleGroup group, Reporter reporter) {
        return run(group, reporter, Map.of());
    }

    private boolean run(ExampleGroup group, Reporter reporter, Map<String, Object> inherited) {
        log.debug("Running group {}", group.metadata().fullDescription());
        ExampleContext groupContext = group.newContext();
        groupContext.inherit(inherited);
        try {
            group.hooks().runGroupHooks(HookPhase.BEFORE, groupContext);
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            log.warn("Group-level before hook failed in {}: {}", group.metadata().fullDescription(), e.toString());
            for (Example example : group.descendantExamples()) {
                example.failWithException(reporter, e);
            }
            runAfterAll(group, groupContext, reporter);
            return false;
        }

        boolean succeeded = true;
        Map<String, Object> shared = Map.copyOf(withoutNulls(groupContext.localState()));
        for (Example example : group.examples()) {
            ExampleContext context = group.newContext();
            context.inherit(shared);
            succeeded &= example.run(context, reporter);
        }
        for (ExampleGroup child : group.children()) {
            succeeded &= run(child, reporter, shared);
        }
        runAfterAll(group, groupContext, reporter);
        return succeeded;
    }

    private void runAfterAll(ExampleGroup group, ExampleContext groupContext, Reporter reporter) {
        try {
            group.hooks().runGroupHooks(HookPhase.AFTER, groupContext);
        } catch (Throwable e) {
            Failures.rethrowIfUnrecoverable(e);
            reporter.message(Failures.diagnostic(e, AFTER_ALL_CONTEXT));
            for (Throwable suppressed : e.getSuppressed()) {
                reporter.message(Failures.diagnostic(suppressed, AFTER_ALL_CONTEXT));
            }
        }
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> values) {
        var copy = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
