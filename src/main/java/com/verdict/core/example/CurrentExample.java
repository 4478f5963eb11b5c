package com.verdict.core.example;

/**
 * The example currently running on this thread.
 * <p>
 * Set when {@link Example#run} starts and cleared when it returns, however it returns.
 * A runner executes one example at a time per thread.
 */
public final class CurrentExample {

    private static final ThreadLocal<Example> CURRENT = new ThreadLocal<>();

    private CurrentExample() {}

    /**
     * @return the running example, or {@code null} outside of an example run
     */
    public static Example get() {
        return CURRENT.get();
    }

    static void set(Example example) {
        CURRENT.set(example);
    }

    static void clear() {
        CURRENT.remove();
    }
}
