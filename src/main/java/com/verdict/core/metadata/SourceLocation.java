package com.verdict.core.metadata;

import java.io.Serializable;

/**
 * File and line an example or group was declared at.
 */
public record SourceLocation(String filePath, int lineNumber) implements Serializable {

    private static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0);

    public static SourceLocation of(String filePath, int lineNumber) {
        return new SourceLocation(filePath, lineNumber);
    }

    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return filePath + ":" + lineNumber;
    }
}
