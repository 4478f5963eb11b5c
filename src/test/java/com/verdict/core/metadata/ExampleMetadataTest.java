package com.verdict.core.metadata;

import com.verdict.core.pending.PendingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExampleMetadataTest {

    private static final SourceLocation LOCATION = SourceLocation.of("spec/order_spec.java", 7);

    private final GroupMetadata root = new GroupMetadata(null, "Order", SourceLocation.unknown(), Map.of("db", true));

    @Nested
    @DisplayName("descriptions")
    class Descriptions {

        @Test
        void joinsGroupAndExampleDescriptions() {
            var nested = new GroupMetadata(root, "when shipped", SourceLocation.unknown(), Map.of());

            var metadata = nested.forExample("sends an email", Map.of(), LOCATION);

            assertEquals("Order when shipped sends an email", metadata.fullDescription());
            assertEquals("sends an email", metadata.description());
        }

        @Test
        void methodNamesAttachWithoutSpace() {
            var method = new GroupMetadata(root, "#total", SourceLocation.unknown(), Map.of());
            var classMethod = new GroupMetadata(root, ".build", SourceLocation.unknown(), Map.of());
            var constant = new GroupMetadata(root, "::Line", SourceLocation.unknown(), Map.of());

            assertEquals("Order#total", method.fullDescription());
            assertEquals("Order.build", classMethod.fullDescription());
            assertEquals("Order::Line", constant.fullDescription());
        }

        @Test
        void missingDescriptionLeavesNoArguments() {
            var metadata = root.forExample(null, Map.of(), LOCATION);

            assertTrue(metadata.descriptionArgs().isEmpty());
            assertEquals("", metadata.description());
            assertEquals("Order", metadata.fullDescription());

            metadata.addDescriptionArg("is valid");

            assertEquals("Order is valid", metadata.fullDescription());
        }
    }

    @Nested
    @DisplayName("tags and flags")
    class TagsAndFlags {

        @Test
        void mergesGroupTagsWithExampleOptions() {
            var metadata = root.forExample("saves", Map.of("slow", true, "db", "postgres"), LOCATION);

            assertEquals("postgres", metadata.tag("db"));
            assertEquals(true, metadata.tag("slow"));
            assertEquals("spec/order_spec.java", metadata.filePath());
        }

        @Test
        void pendingOptionRecordsMessage() {
            var withReason = root.forExample("saves", Map.of(ExampleMetadata.PENDING, "schema change"), LOCATION);
            var withoutReason = root.forExample("saves", Map.of(ExampleMetadata.PENDING, true), LOCATION);

            assertTrue(withReason.isPending());
            assertEquals("schema change", withReason.executionResult().pendingMessage());
            assertEquals(PendingPolicy.NO_REASON_GIVEN, withoutReason.executionResult().pendingMessage());
        }

        @Test
        void falseFlagsAreIgnored() {
            var metadata = root.forExample("saves",
                    Map.of(ExampleMetadata.PENDING, false, ExampleMetadata.SKIP, false), LOCATION);

            assertFalse(metadata.isPending());
            assertFalse(metadata.isSkip());
            assertNull(metadata.executionResult().pendingMessage());
        }

        @Test
        void resetForRunRestoresDeclaredFlags() {
            var metadata = root.forExample("prints", Map.of(ExampleMetadata.PENDING, "driver missing"), LOCATION);
            metadata.setPending(false);
            metadata.setSkip(true, "no paper");
            metadata.executionResult().setPendingMessage("no paper");

            metadata.resetForRun();

            assertTrue(metadata.isPending());
            assertFalse(metadata.isSkip());
            assertNull(metadata.skipMessage());
            assertEquals("driver missing", metadata.executionResult().pendingMessage());
        }

        @Test
        void skipOptionRecordsMessage() {
            var metadata = root.forExample("prints", Map.of(ExampleMetadata.SKIP, "no printer"), LOCATION);

            assertTrue(metadata.isSkip());
            assertEquals("no printer", metadata.skipMessage());
        }
    }

    @Test
    void sourceLocationFormatsAsPathAndLine() {
        assertEquals("spec/order_spec.java:7", LOCATION.toString());
        assertEquals("unknown:0", SourceLocation.unknown().toString());
    }
}
