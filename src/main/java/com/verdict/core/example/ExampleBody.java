package com.verdict.core.example;

/**
 * The code of an example. Receives the run's context, which also exposes the example.
 */
@FunctionalInterface
public interface ExampleBody {

    void run(ExampleContext context) throws Exception;
}
