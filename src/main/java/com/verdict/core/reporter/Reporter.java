package com.verdict.core.reporter;

import com.verdict.core.example.Example;

import java.util.Map;

/**
 * Receives the lifecycle events of example runs.
 */
public interface Reporter {

    void exampleStarted(Example example);

    void examplePassed(Example example);

    void exampleFailed(Example example);

    void examplePending(Example example);

    /** Free-form diagnostic text, e.g. failures that were not reported as an example's result. */
    void message(String message);

    void deprecation(Map<String, Object> fields);
}
