package com.verdict.core.mocks;

/**
 * Lifecycle calls made into the mocking library around each example.
 * <p>
 * {@link #verifyMocks()} may throw when expectations were not met; {@link #teardownMocks()}
 * is always called, whatever happened before it.
 */
public interface MockLifecycle {

    MockLifecycle NONE = new MockLifecycle() {
        @Override
        public void setupMocks() {
        }

        @Override
        public void verifyMocks() {
        }

        @Override
        public void teardownMocks() {
        }
    };

    void setupMocks() throws Exception;

    void verifyMocks() throws Exception;

    void teardownMocks() throws Exception;
}
