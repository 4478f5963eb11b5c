package com.verdict.core.example;

import com.verdict.core.metadata.ExampleMetadata;

/**
 * The rest of an example's pipeline, handed to around hooks.
 * <p>
 * Not calling {@link #run()} means nothing inside it runs: no before or after hooks and no
 * example body. Calling it more than once runs the pipeline again each time.
 *
 * <pre>
 * group.around((context, example) -&gt; {
 *     if (example.metadata().tag("slow") == null || runSlowExamples) {
 *         example.run();
 *     }
 * });
 * </pre>
 */
public final class Procsy {

    /**
     * The deferred pipeline.
     */
    @FunctionalInterface
    public interface Body {
        void call() throws Exception;
    }

    private final ExampleMetadata metadata;
    private final Body body;

    public Procsy(ExampleMetadata metadata, Body body) {
        this.metadata = metadata;
        this.body = body;
    }

    /** The metadata of the example being wrapped. */
    public ExampleMetadata metadata() {
        return metadata;
    }

    public void run() throws Exception {
        body.call();
    }

    /**
     * A procsy for the same example around a different body, used to layer around hooks.
     */
    public Procsy wrap(Body body) {
        return new Procsy(metadata, body);
    }
}
