package com.verdict.core.hooks;

import com.verdict.core.example.ExampleContext;

/**
 * A before or after hook.
 */
@FunctionalInterface
public interface Hook {

    void run(ExampleContext context) throws Exception;
}
