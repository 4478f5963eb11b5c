package com.verdict.core.hooks;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleContext;
import com.verdict.core.example.Failures;
import com.verdict.core.example.Procsy;
import com.verdict.core.metadata.ExampleMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * In-memory, ordered hook registry for one example group.
 * <p>
 * A nested group's registry links to its parent's: inherited before and around hooks run
 * ahead of the group's own, inherited after hooks run behind them. Group-level
 * ({@link HookScope#ALL}) hooks are never inherited.
 */
public class DefaultHookRegistry implements HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultHookRegistry.class);

    private record Registered<H>(Predicate<ExampleMetadata> filter, H hook) {
        boolean appliesTo(Example example) {
            return filter.test(example.metadata());
        }
    }

    private final DefaultHookRegistry parent;
    private final Map<HookScope, List<Registered<Hook>>> beforeHooks = new EnumMap<>(HookScope.class);
    private final Map<HookScope, List<Registered<Hook>>> afterHooks = new EnumMap<>(HookScope.class);
    private final List<Registered<AroundHook>> aroundHooks = new ArrayList<>();

    public DefaultHookRegistry() {
        this(null);
    }

    public DefaultHookRegistry(DefaultHookRegistry parent) {
        this.parent = parent;
        for (HookScope scope : HookScope.values()) {
            beforeHooks.put(scope, new ArrayList<>());
            afterHooks.put(scope, new ArrayList<>());
        }
    }

    // -- Registration ---------------------------------------------------------

    public void before(HookScope scope, Hook hook) {
        before(scope, metadata -> true, hook);
    }

    public void before(HookScope scope, Predicate<ExampleMetadata> filter, Hook hook) {
        beforeHooks.get(scope).add(new Registered<>(filter, hook));
    }

    public void after(HookScope scope, Hook hook) {
        after(scope, metadata -> true, hook);
    }

    public void after(HookScope scope, Predicate<ExampleMetadata> filter, Hook hook) {
        afterHooks.get(scope).add(new Registered<>(filter, hook));
    }

    public void around(AroundHook hook) {
        around(metadata -> true, hook);
    }

    public void around(Predicate<ExampleMetadata> filter, AroundHook hook) {
        aroundHooks.add(new Registered<>(filter, hook));
    }

    // -- Execution ------------------------------------------------------------

    @Override
    public void run(HookPhase phase, HookScope scope, Example example) throws Exception {
        if (scope == HookScope.ALL) {
            runGroupHooks(phase, example.context());
            return;
        }
        switch (phase) {
            case BEFORE -> {
                for (Hook hook : beforeEachHooksFor(example)) {
                    hook.run(example.context());
                }
            }
            case AFTER -> runAfterEach(example);
            case AROUND -> throw new IllegalArgumentException("Around hooks are run through runAround");
        }
    }

    @Override
    public void runAround(Example example, Procsy procsy) throws Exception {
        List<AroundHook> hooks = aroundHooksFor(example);
        Procsy wrapped = procsy;
        for (int i = hooks.size() - 1; i >= 0; i--) {
            AroundHook hook = hooks.get(i);
            Procsy inner = wrapped;
            wrapped = procsy.wrap(() -> hook.run(example.context(), inner));
        }
        wrapped.run();
    }

    @Override
    public List<AroundHook> aroundHooksFor(Example example) {
        var hooks = new ArrayList<AroundHook>();
        if (parent != null) {
            hooks.addAll(parent.aroundHooksFor(example));
        }
        for (Registered<AroundHook> registered : aroundHooks) {
            if (registered.appliesTo(example)) {
                hooks.add(registered.hook());
            }
        }
        return List.copyOf(hooks);
    }

    /**
     * Before hooks stop at the first failure. After hooks all run, in reverse registration
     * order; the first failure is thrown with the others attached as suppressed.
     */
    @Override
    public void runGroupHooks(HookPhase phase, ExampleContext context) throws Exception {
        switch (phase) {
            case BEFORE -> {
                for (Registered<Hook> registered : beforeHooks.get(HookScope.ALL)) {
                    registered.hook().run(context);
                }
            }
            case AFTER -> {
                Exception first = null;
                List<Registered<Hook>> hooks = afterHooks.get(HookScope.ALL);
                for (int i = hooks.size() - 1; i >= 0; i--) {
                    try {
                        hooks.get(i).hook().run(context);
                    } catch (Exception e) {
                        if (first == null) {
                            first = e;
                        } else {
                            first.addSuppressed(e);
                        }
                    }
                }
                if (first != null) {
                    throw first;
                }
            }
            case AROUND -> throw new IllegalArgumentException("Around hooks cannot run at group level");
        }
    }

    private List<Hook> beforeEachHooksFor(Example example) {
        var hooks = new ArrayList<Hook>();
        if (parent != null) {
            hooks.addAll(parent.beforeEachHooksFor(example));
        }
        for (Registered<Hook> registered : beforeHooks.get(HookScope.EACH)) {
            if (registered.appliesTo(example)) {
                hooks.add(registered.hook());
            }
        }
        return hooks;
    }

    private List<Hook> afterEachHooksFor(Example example) {
        var hooks = new ArrayList<Hook>();
        List<Registered<Hook>> own = afterHooks.get(HookScope.EACH);
        for (int i = own.size() - 1; i >= 0; i--) {
            if (own.get(i).appliesTo(example)) {
                hooks.add(own.get(i).hook());
            }
        }
        if (parent != null) {
            hooks.addAll(parent.afterEachHooksFor(example));
        }
        return hooks;
    }

    // Every after hook runs; each failure goes through the example's capture rule.
    private void runAfterEach(Example example) {
        for (Hook hook : afterEachHooksFor(example)) {
            try {
                hook.run(example.context());
            } catch (Throwable e) {
                Failures.rethrowIfUnrecoverable(e);
                log.debug("After hook failed for example {}: {}", example.id(), e.toString());
                example.captureFailure(e, Example.AFTER_EACH_CONTEXT);
            }
        }
    }
}
