package com.verdict.core.example;

import com.verdict.core.mocks.MockLifecycle;
import com.verdict.core.pending.PendingPolicy;
import com.verdict.core.pending.SkipDeclaredInExample;
import com.verdict.core.warnings.WarnOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State an example body and its hooks may touch during one run.
 * <p>
 * A context is created per run and owned by it: its local values are wiped when the run
 * ends so nothing leaks into the next example.
 */
public final class ExampleContext {

    private final MockLifecycle mocks;
    private final Map<String, Object> locals = new LinkedHashMap<>();
    private Example example;

    public ExampleContext() {
        this(MockLifecycle.NONE);
    }

    public ExampleContext(MockLifecycle mocks) {
        this.mocks = mocks;
    }

    /** The example being run, {@code null} once the run is over. */
    public Example example() {
        return example;
    }

    public MockLifecycle mocks() {
        return mocks;
    }

    public void set(String name, Object value) {
        locals.put(name, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        return (T) locals.get(name);
    }

    public boolean has(String name) {
        return locals.containsKey(name);
    }

    /**
     * Returns the value stored under {@code name}, computing and storing it on first use.
     */
    @SuppressWarnings("unchecked")
    public <T> T let(String name, Supplier<T> supplier) {
        if (!locals.containsKey(name)) {
            locals.put(name, supplier.get());
        }
        return (T) locals.get(name);
    }

    public Map<String, Object> localState() {
        return Collections.unmodifiableMap(locals);
    }

    /**
     * Copies values set up by group-level hooks into this context.
     */
    public void inherit(Map<String, Object> values) {
        locals.putAll(values);
    }

    /**
     * Marks the running example pending. The body keeps running and is then expected to fail.
     */
    public void pending(String reason) {
        PendingPolicy.markPending(requireExample(), reason);
    }

    public void pending() {
        pending(null);
    }

    /**
     * Marks the running example skipped and stops the rest of the body.
     */
    public void skip(String reason) {
        PendingPolicy.markSkipped(requireExample(), reason);
        throw new SkipDeclaredInExample(reason);
    }

    public void skip() {
        skip(null);
    }

    /**
     * Emits a warning tagged with the location of the running example.
     */
    public void warn(String message) {
        requireExample().warnings().warnWith(message, WarnOptions.defaults().withSpecLocation());
    }

    void bind(Example example) {
        this.example = example;
    }

    void clearLocalState() {
        locals.clear();
        example = null;
    }

    private Example requireExample() {
        if (example == null) {
            throw new IllegalStateException("No example is running in this context");
        }
        return example;
    }
}
