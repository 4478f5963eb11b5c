package com.verdict.core.description;

/**
 * {@link DescriptionSource} that matchers write into as they are evaluated.
 * Confined to the thread running the example.
 */
public class RecordingDescriptionSource implements DescriptionSource {

    private final ThreadLocal<String> lastDescription = new ThreadLocal<>();

    public void record(String description) {
        lastDescription.set(description);
    }

    @Override
    public String lastGeneratedDescription() {
        return lastDescription.get();
    }

    @Override
    public void clear() {
        lastDescription.remove();
    }
}
