package com.verdict.core.clock;

import java.time.Clock;
import java.time.Instant;

/**
 * Time source used to stamp example runs.
 */
@FunctionalInterface
public interface ExampleClock {

    Instant now();

    static ExampleClock system() {
        return of(Clock.systemUTC());
    }

    static ExampleClock of(Clock clock) {
        return clock::instant;
    }
}
