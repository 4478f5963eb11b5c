package com.verdict.core.metadata;

import com.verdict.core.example.ExecutionResult;
import com.verdict.core.pending.PendingPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Metadata of a single example, derived once from its group's metadata.
 * <p>
 * Only the pending/skip flags, the description arguments and the execution result change
 * after construction. {@link #resetForRun()} restores the declared flags before each run.
 */
public class ExampleMetadata {

    public static final String PENDING = "pending";
    public static final String SKIP = "skip";

    private final GroupMetadata group;
    private final List<Object> descriptionArgs = new ArrayList<>();
    private final SourceLocation location;
    private final Map<String, Object> tags;
    private final ExecutionResult executionResult = new ExecutionResult();
    private final String declaredPendingMessage;
    private final String declaredSkipMessage;
    private boolean pending;
    private boolean skip;
    private String skipMessage;

    ExampleMetadata(GroupMetadata group, String description, Map<String, Object> options,
                    SourceLocation location) {
        this.group = group;
        this.location = location;
        if (description != null && !description.isEmpty()) {
            descriptionArgs.add(description);
        }
        var merged = new LinkedHashMap<String, Object>(group.tags());
        merged.putAll(options);
        this.tags = Collections.unmodifiableMap(merged);

        Object pendingValue = options.get(PENDING);
        this.declaredPendingMessage = isSet(pendingValue) ? messageOf(pendingValue) : null;
        Object skipValue = options.get(SKIP);
        this.declaredSkipMessage = isSet(skipValue) ? messageOf(skipValue) : null;
        resetForRun();
    }

    /**
     * Clears the execution result and any pending or skip state set while running, keeping
     * what the example was declared with.
     */
    public void resetForRun() {
        executionResult.reset();
        pending = declaredPendingMessage != null;
        skip = declaredSkipMessage != null;
        skipMessage = declaredSkipMessage;
        if (pending) {
            executionResult.setPendingMessage(declaredPendingMessage);
        }
    }

    public GroupMetadata group() { return group; }
    public SourceLocation location() { return location; }
    public String filePath() { return location.filePath(); }
    public ExecutionResult executionResult() { return executionResult; }
    public Map<String, Object> tags() { return tags; }
    public Object tag(String key) { return tags.get(key); }
    public boolean isPending() { return pending; }
    public boolean isSkip() { return skip; }

    /** Reason the example is skipped, {@link PendingPolicy#NO_REASON_GIVEN} when none was given. */
    public String skipMessage() { return skipMessage; }

    public List<Object> descriptionArgs() { return Collections.unmodifiableList(descriptionArgs); }

    public String description() {
        return descriptionArgs.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }

    public String fullDescription() {
        return GroupMetadata.joinDescriptions(group.fullDescription(), description());
    }

    public void setPending(boolean pending) { this.pending = pending; }

    public void setSkip(boolean skip, String skipMessage) {
        this.skip = skip;
        this.skipMessage = skipMessage;
    }

    public void addDescriptionArg(Object arg) {
        descriptionArgs.add(arg);
    }

    private static boolean isSet(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    private static String messageOf(Object value) {
        return value instanceof String ? (String) value : PendingPolicy.NO_REASON_GIVEN;
    }
}
