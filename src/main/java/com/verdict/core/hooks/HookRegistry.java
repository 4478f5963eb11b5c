package com.verdict.core.hooks;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleContext;
import com.verdict.core.example.Procsy;

import java.util.List;

/**
 * Hooks applicable to the examples of a group.
 */
public interface HookRegistry {

    /**
     * Runs the {@link HookPhase#BEFORE} or {@link HookPhase#AFTER} hooks of the given scope
     * that apply to the example, in the example's current context.
     */
    void run(HookPhase phase, HookScope scope, Example example) throws Exception;

    /**
     * Runs the around hooks applying to the example, outermost first, with the innermost
     * hook receiving {@code procsy}.
     */
    void runAround(Example example, Procsy procsy) throws Exception;

    List<AroundHook> aroundHooksFor(Example example);

    /**
     * Runs the group-level ({@link HookScope#ALL}) hooks of the given phase.
     */
    void runGroupHooks(HookPhase phase, ExampleContext context) throws Exception;
}
