package com.verdict.core.metadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata of a declared example group. Nested groups link to their parent, which supplies
 * the leading part of full descriptions and inherited tags.
 */
public class GroupMetadata {

    private final GroupMetadata parent;
    private final String description;
    private final SourceLocation location;
    private final Map<String, Object> tags;

    public GroupMetadata(GroupMetadata parent, String description, SourceLocation location,
                         Map<String, Object> tags) {
        this.parent = parent;
        this.description = description == null ? "" : description;
        this.location = location;
        var merged = new LinkedHashMap<String, Object>();
        if (parent != null) {
            merged.putAll(parent.tags());
        }
        merged.putAll(tags);
        this.tags = Map.copyOf(merged);
    }

    public GroupMetadata parent() { return parent; }
    public String description() { return description; }
    public SourceLocation location() { return location; }
    public Map<String, Object> tags() { return tags; }

    public String fullDescription() {
        return parent == null ? description : joinDescriptions(parent.fullDescription(), description);
    }

    /**
     * Derives the metadata of an example declared directly in this group.
     */
    public ExampleMetadata forExample(String description, Map<String, Object> options, SourceLocation location) {
        return new ExampleMetadata(this, description, options, location);
    }

    /**
     * Joins two description parts with a space, except before parts naming a method
     * ({@code #method}, {@code .method}) or a nested constant ({@code ::Name}).
     */
    static String joinDescriptions(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        if (tail.isEmpty()) {
            return head;
        }
        if (tail.startsWith("#") || tail.startsWith(".") || tail.startsWith("::")) {
            return head + tail;
        }
        return head + " " + tail;
    }
}
