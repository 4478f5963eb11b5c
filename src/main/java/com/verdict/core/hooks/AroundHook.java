package com.verdict.core.hooks;

import com.verdict.core.example.ExampleContext;
import com.verdict.core.example.Procsy;

/**
 * A hook wrapping the rest of an example's pipeline. The hook decides whether, when and how
 * often the wrapped pipeline runs by calling {@link Procsy#run()}.
 */
@FunctionalInterface
public interface AroundHook {

    void run(ExampleContext context, Procsy example) throws Exception;
}
