package com.verdict.core.group;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleBody;
import com.verdict.core.example.ExampleContext;
import com.verdict.core.example.ExampleEnvironment;
import com.verdict.core.hooks.AroundHook;
import com.verdict.core.hooks.DefaultHookRegistry;
import com.verdict.core.hooks.Hook;
import com.verdict.core.hooks.HookRegistry;
import com.verdict.core.hooks.HookScope;
import com.verdict.core.metadata.ExampleMetadata;
import com.verdict.core.metadata.GroupMetadata;
import com.verdict.core.metadata.SourceLocation;
import com.verdict.core.mocks.MockLifecycle;
import com.verdict.core.warnings.CallerFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A described group of examples, with its hooks and nested groups.
 *
 * <pre>
 * var calculator = ExampleGroup.describe("Calculator");
 * calculator.before(HookScope.EACH, context -&gt; context.set("calc", new Calculator()));
 * calculator.example("adds", context -&gt; {
 *     Calculator calc = context.get("calc");
 *     assertEquals(4, calc.add(2, 2));
 * });
 * var division = calculator.context("#divide");
 * division.pending("rounds towards zero", context -&gt; ...);
 * </pre>
 */
public class ExampleGroup {

    private final ExampleGroup parent;
    private final GroupMetadata metadata;
    private final ExampleEnvironment environment;
    private final DefaultHookRegistry hooks;
    private final List<Example> examples = new ArrayList<>();
    private final List<ExampleGroup> children = new ArrayList<>();
    private Supplier<MockLifecycle> mocks;

    protected ExampleGroup(ExampleGroup parent, String description, Map<String, Object> tags,
                           SourceLocation location, ExampleEnvironment environment) {
        this.parent = parent;
        this.metadata = new GroupMetadata(parent == null ? null : parent.metadata, description, location, tags);
        this.environment = environment;
        this.hooks = new DefaultHookRegistry(parent == null ? null : parent.hooks);
    }

    public static ExampleGroup describe(String description) {
        return describe(description, ExampleEnvironment.defaults());
    }

    public static ExampleGroup describe(String description, ExampleEnvironment environment) {
        return new ExampleGroup(null, description, Map.of(), CallerFilter.framework().firstLocation(), environment);
    }

    public static ExampleGroup describe(String description, Map<String, Object> tags, ExampleEnvironment environment) {
        return new ExampleGroup(null, description, tags, CallerFilter.framework().firstLocation(), environment);
    }

    /**
     * Declares a nested group sharing this group's environment, hooks and mocks.
     */
    public ExampleGroup context(String description) {
        return context(description, Map.of());
    }

    public ExampleGroup context(String description, Map<String, Object> tags) {
        var child = new ExampleGroup(this, description, tags, CallerFilter.framework().firstLocation(), environment);
        children.add(child);
        return child;
    }

    // -- Examples -------------------------------------------------------------

    public Example example(String description, ExampleBody body) {
        return example(description, Map.of(), body);
    }

    public Example example(String description, Map<String, Object> options, ExampleBody body) {
        return example(description, options, CallerFilter.framework().firstLocation(), body);
    }

    public Example example(String description, Map<String, Object> options, SourceLocation location,
                           ExampleBody body) {
        var example = new Example(this, description, options, location, body);
        examples.add(example);
        return example;
    }

    /** Declares an example that is expected to fail. */
    public Example pending(String description, ExampleBody body) {
        return example(description, Map.of(ExampleMetadata.PENDING, true), body);
    }

    public Example skip(String description, ExampleBody body) {
        return example(description, Map.of(ExampleMetadata.SKIP, true), body);
    }

    // -- Hooks ----------------------------------------------------------------

    public ExampleGroup before(HookScope scope, Hook hook) {
        hooks.before(scope, hook);
        return this;
    }

    public ExampleGroup before(HookScope scope, Predicate<ExampleMetadata> filter, Hook hook) {
        hooks.before(scope, filter, hook);
        return this;
    }

    public ExampleGroup after(HookScope scope, Hook hook) {
        hooks.after(scope, hook);
        return this;
    }

    public ExampleGroup after(HookScope scope, Predicate<ExampleMetadata> filter, Hook hook) {
        hooks.after(scope, filter, hook);
        return this;
    }

    public ExampleGroup around(AroundHook hook) {
        hooks.around(hook);
        return this;
    }

    public ExampleGroup around(Predicate<ExampleMetadata> filter, AroundHook hook) {
        hooks.around(filter, hook);
        return this;
    }

    /**
     * Sets the factory creating the mock lifecycle of each example run in this group.
     */
    public ExampleGroup mocks(Supplier<MockLifecycle> mocks) {
        this.mocks = mocks;
        return this;
    }

    /** A fresh context for one example run, with mocks from the nearest group that sets them. */
    public ExampleContext newContext() {
        for (ExampleGroup group = this; group != null; group = group.parent) {
            if (group.mocks != null) {
                return new ExampleContext(group.mocks.get());
            }
        }
        return new ExampleContext(MockLifecycle.NONE);
    }

    // -- Accessors ------------------------------------------------------------

    public HookRegistry hooks() { return hooks; }
    public GroupMetadata metadata() { return metadata; }
    public ExampleEnvironment environment() { return environment; }
    public ExampleGroup parent() { return parent; }
    public String description() { return metadata.description(); }
    public List<Example> examples() { return Collections.unmodifiableList(examples); }
    public List<ExampleGroup> children() { return Collections.unmodifiableList(children); }

    /** Examples of this group and all nested groups, in declaration order. */
    public List<Example> descendantExamples() {
        var all = new ArrayList<>(examples);
        for (ExampleGroup child : children) {
            all.addAll(child.descendantExamples());
        }
        return all;
    }

    @Override
    public String toString() {
        return "ExampleGroup{" + metadata.fullDescription() + "}";
    }
}
