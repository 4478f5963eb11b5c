package com.verdict.core.warnings;

import com.verdict.core.metadata.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * Finds the first stack frame outside of the framework, i.e. the user code that called in.
 * <p>
 * Ignored entries ending with {@code .} are package prefixes; other entries are class names,
 * which also cover their nested classes and lambdas.
 */
public final class CallerFilter {

    private static final CallerFilter FRAMEWORK = new CallerFilter(List.of(
            "java.", "jdk.", "sun.",
            "com.verdict.core.example.Example",
            "com.verdict.core.example.ExampleContext",
            "com.verdict.core.group.ExampleGroup",
            "com.verdict.core.warnings.CallerFilter",
            "com.verdict.core.warnings.Warnings"));

    private final List<String> ignored;

    private CallerFilter(List<String> ignored) {
        this.ignored = ignored;
    }

    public static CallerFilter framework() {
        return FRAMEWORK;
    }

    public static CallerFilter ignoring(String... entries) {
        return new CallerFilter(List.of(entries));
    }

    /**
     * @return {@code path/File.java:line} of the first non-framework frame, or {@code null}
     */
    public String firstNonFrameworkLine() {
        return firstFrame().map(SourceLocation::toString).orElse(null);
    }

    public SourceLocation firstLocation() {
        return firstFrame().orElse(SourceLocation.unknown());
    }

    private Optional<SourceLocation> firstFrame() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(frame -> !isIgnored(frame.getClassName()))
                .findFirst()
                .map(frame -> SourceLocation.of(pathOf(frame.getClassName(), frame.getFileName()),
                        frame.getLineNumber())));
    }

    boolean isIgnored(String className) {
        for (String entry : ignored) {
            if (entry.endsWith(".")) {
                if (className.startsWith(entry)) {
                    return true;
                }
            } else if (className.equals(entry) || className.startsWith(entry + "$")) {
                return true;
            }
        }
        return false;
    }

    private static String pathOf(String className, String fileName) {
        int lastDot = className.lastIndexOf('.');
        String file = fileName != null ? fileName : className.substring(lastDot + 1) + ".java";
        return lastDot < 0 ? file : className.substring(0, lastDot).replace('.', '/') + "/" + file;
    }
}
