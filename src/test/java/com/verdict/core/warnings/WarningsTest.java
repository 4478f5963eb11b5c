package com.verdict.core.warnings;

import com.verdict.core.group.ExampleGroup;
import com.verdict.core.metadata.SourceLocation;
import com.verdict.core.reporter.Reporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WarningsTest {

    private Reporter reporter;
    private List<String> emitted;
    private Warnings warnings;

    @BeforeEach
    void setUp() {
        reporter = mock(Reporter.class);
        emitted = new ArrayList<>();
        warnings = new Warnings(reporter, emitted::add, CallerFilter.framework());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> reportedDeprecation() {
        ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
        verify(reporter).deprecation(fields.capture());
        return fields.getValue();
    }

    @Nested
    @DisplayName("deprecate")
    class Deprecate {

        @Test
        @DisplayName("reports the deprecated feature with the calling line")
        void reportsCallSite() {
            warnings.deprecate("Example#options");

            var fields = reportedDeprecation();
            assertEquals("Example#options", fields.get("deprecated"));
            assertTrue(((String) fields.get("callSite")).startsWith("com/verdict/core/warnings/WarningsTest.java:"));
        }

        @Test
        @DisplayName("passes extra data through and lets it override the call site")
        void dataOverridesCallSite() {
            warnings.deprecate("Example#options",
                    Map.of("replacement", "Example#metadata", "callSite", "spec/legacy_spec.java:3"));

            var fields = reportedDeprecation();
            assertEquals("Example#metadata", fields.get("replacement"));
            assertEquals("spec/legacy_spec.java:3", fields.get("callSite"));
        }

        @Test
        @DisplayName("is only logged without a reporter")
        void withoutReporter() {
            var unreported = new Warnings(null, emitted::add, CallerFilter.framework());

            assertDoesNotThrow(() -> unreported.deprecate("Example#options"));
            assertTrue(emitted.isEmpty());
        }

        @Test
        @DisplayName("warnDeprecation sends the message as is")
        void warnDeprecation() {
            warnings.warnDeprecation("Use --format instead of --formatter");

            assertEquals(Map.of("message", "Use --format instead of --formatter"), reportedDeprecation());
        }

        @Test
        @DisplayName("the deprecated options accessor reports its replacement")
        @SuppressWarnings("deprecation")
        void deprecatedOptions() {
            var example = ExampleGroup.describe("Legacy")
                    .example("reads options", Map.of("slow", true), SourceLocation.of("spec/legacy_spec.java", 5),
                            context -> assertEquals(true, context.example().options().get("slow")));

            assertTrue(example.run(example.exampleGroup().newContext(), reporter));

            var fields = reportedDeprecation();
            assertEquals("Example#options", fields.get("deprecated"));
            assertEquals("Example#metadata", fields.get("replacement"));
        }
    }

    @Nested
    @DisplayName("warnWith")
    class WarnWith {

        @Test
        @DisplayName("appends the call site by default")
        void callSite() {
            warnings.warnWith("Stubbing a final method");

            assertEquals(1, emitted.size());
            assertTrue(emitted.get(0).startsWith("Stubbing a final method Called from com/verdict/core/warnings/WarningsTest.java:"));
            assertTrue(emitted.get(0).endsWith("."));
        }

        @Test
        @DisplayName("uses an explicit call site, or none")
        void explicitCallSite() {
            warnings.warnWith("Deprecated matcher", WarnOptions.defaults().withCallSite("spec/a_spec.java:9"));
            warnings.warnWith("Deprecated matcher", WarnOptions.defaults().withCallSite(null));

            assertEquals(List.of("Deprecated matcher Called from spec/a_spec.java:9.", "Deprecated matcher"), emitted);
        }

        @Test
        @DisplayName("names the running example's location")
        void specLocation() {
            var example = ExampleGroup.describe("Mocks")
                    .example("stubs", Map.of(), SourceLocation.of("spec/mocks_spec.java", 12),
                            context -> warnings.warnWith("Stubbing nil",
                                    WarnOptions.defaults().withSpecLocation().withCallSite(null)));

            example.run(example.exampleGroup().newContext(), reporter);

            assertEquals(List.of("Stubbing nil. Warning generated from spec at `spec/mocks_spec.java:12`."), emitted);
        }

        @Test
        @DisplayName("says so when no example is running")
        void noRunningExample() {
            warnings.warnWith("Stubbing nil.", WarnOptions.defaults().withSpecLocation().withCallSite(null));

            assertEquals(List.of("Stubbing nil. Verdict could not determine which call generated this warning."),
                    emitted);
        }
    }

    @Test
    @DisplayName("ignored entries cover packages, classes and their nested classes")
    void callerFilterMatching() {
        var filter = CallerFilter.ignoring("org.mockito.", "com.acme.Runner");

        assertTrue(filter.isIgnored("org.mockito.internal.Handler"));
        assertTrue(filter.isIgnored("com.acme.Runner"));
        assertTrue(filter.isIgnored("com.acme.Runner$1"));
        assertFalse(filter.isIgnored("com.acme.RunnerTest"));
        assertTrue(CallerFilter.framework().isIgnored("com.verdict.core.example.Example$Lambda"));
        assertFalse(CallerFilter.framework().isIgnored("com.verdict.core.example.ExampleTest"));
    }
}
