package com.verdict.core.hooks;

import com.verdict.core.example.Example;
import com.verdict.core.example.ExampleContext;
import com.verdict.core.group.ExampleGroup;
import com.verdict.core.reporter.Reporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class DefaultHookRegistryTest {

    private ExampleGroup outer;
    private ExampleGroup inner;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        outer = ExampleGroup.describe("Account");
        inner = outer.context("when frozen");
        calls = new ArrayList<>();
    }

    private Hook recording(String name) {
        return context -> calls.add(name);
    }

    private Example run(ExampleGroup group, Map<String, Object> options) {
        var example = group.example("works", options, context -> calls.add("body"));
        example.run(group.newContext(), mock(Reporter.class));
        return example;
    }

    @Nested
    @DisplayName("each-example hooks")
    class EachHooks {

        @Test
        @DisplayName("inherited before hooks run first and inherited after hooks run last")
        void nesting() {
            outer.before(HookScope.EACH, recording("outer before 1"));
            outer.before(HookScope.EACH, recording("outer before 2"));
            inner.before(HookScope.EACH, recording("inner before"));
            outer.after(HookScope.EACH, recording("outer after 1"));
            outer.after(HookScope.EACH, recording("outer after 2"));
            inner.after(HookScope.EACH, recording("inner after"));

            run(inner, Map.of());

            assertEquals(List.of("outer before 1", "outer before 2", "inner before", "body",
                    "inner after", "outer after 2", "outer after 1"), calls);
        }

        @Test
        @DisplayName("hooks in nested groups do not apply to the parent's examples")
        void childHooksStayInChild() {
            inner.before(HookScope.EACH, recording("inner before"));

            run(outer, Map.of());

            assertEquals(List.of("body"), calls);
        }

        @Test
        @DisplayName("filters select hooks by example metadata")
        void filters() {
            outer.before(HookScope.EACH, metadata -> metadata.tag("db") != null, recording("db before"));
            outer.after(HookScope.EACH, metadata -> metadata.tag("db") != null, recording("db after"));

            run(outer, Map.of());
            run(outer, Map.of("db", true));

            assertEquals(List.of("body", "db before", "body", "db after"), calls);
        }

        @Test
        @DisplayName("before hooks stop at the first failure")
        void beforeStopsAtFailure() {
            outer.before(HookScope.EACH, context -> {
                throw new IllegalStateException("first");
            });
            outer.before(HookScope.EACH, recording("second before"));

            var example = run(outer, Map.of());

            assertEquals("first", example.exception().getMessage());
            assertEquals(List.of(), calls);
        }

        @Test
        @DisplayName("every after hook runs and the first failure is kept")
        void afterRunsAll() {
            outer.after(HookScope.EACH, recording("last registered runs last"));
            outer.after(HookScope.EACH, context -> {
                throw new IllegalStateException("second registered");
            });
            outer.after(HookScope.EACH, context -> {
                throw new IllegalStateException("third registered");
            });

            var example = run(outer, Map.of());

            assertEquals("third registered", example.exception().getMessage());
            assertEquals(List.of("body", "last registered runs last"), calls);
        }
    }

    @Nested
    @DisplayName("around hooks")
    class AroundHooks {

        @Test
        @DisplayName("inherited around hooks wrap the group's own")
        void nesting() {
            AroundHook outerHook = (context, example) -> {
                calls.add("outer");
                example.run();
            };
            AroundHook innerHook = (context, example) -> {
                calls.add("inner");
                example.run();
            };
            outer.around(outerHook);
            inner.around(innerHook);
            var example = inner.example("works", context -> calls.add("body"));

            assertEquals(List.of(outerHook, innerHook), inner.hooks().aroundHooksFor(example));

            example.run(inner.newContext(), mock(Reporter.class));

            assertEquals(List.of("outer", "inner", "body"), calls);
        }
    }

    @Nested
    @DisplayName("group hooks")
    class GroupHooks {

        @Test
        @DisplayName("run for the group only and are not inherited")
        void notInherited() throws Exception {
            outer.before(HookScope.ALL, recording("outer before all"));
            inner.before(HookScope.ALL, recording("inner before all"));

            inner.hooks().runGroupHooks(HookPhase.BEFORE, new ExampleContext());

            assertEquals(List.of("inner before all"), calls);
        }

        @Test
        @DisplayName("after hooks all run in reverse order and report the first failure")
        void afterAllCollectsFailures() {
            outer.after(HookScope.ALL, recording("registered first"));
            outer.after(HookScope.ALL, context -> {
                throw new IllegalStateException("registered second");
            });
            outer.after(HookScope.ALL, context -> {
                throw new IllegalArgumentException("registered third");
            });

            var thrown = assertThrows(IllegalArgumentException.class,
                    () -> outer.hooks().runGroupHooks(HookPhase.AFTER, new ExampleContext()));

            assertEquals("registered third", thrown.getMessage());
            assertEquals(1, thrown.getSuppressed().length);
            assertEquals("registered second", thrown.getSuppressed()[0].getMessage());
            assertEquals(List.of("registered first"), calls);
        }

        @Test
        @DisplayName("around hooks cannot run at group level")
        void aroundRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> outer.hooks().runGroupHooks(HookPhase.AROUND, new ExampleContext()));
        }
    }
}
