package com.designlens.core.grouping;

import com.designlens.core.extraction.StructuralExtractor;
import com.designlens.core.model.ComponentDescriptor;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.designlens.core.TestDescriptors.at;
import static com.designlens.core.TestDescriptors.paymentScreen;
import static org.junit.jupiter.api.Assertions.*;

class GroupingPromptBuilderTest {

    private static List<ComponentDescriptor> descriptors;

    @BeforeAll
    static void extract() {
        descriptors = new StructuralExtractor().extract(paymentScreen()).descriptors();
    }

    @Test
    @DisplayName("The prompt names the design and carries every section")
    void containsAllSections() {
        String prompt = GroupingPromptBuilder.build("Checkout", descriptors);

        assertTrue(prompt.contains("\"Checkout\""));
        assertTrue(prompt.contains("from " + descriptors.size() + " technical nodes"));
        for (String heading : List.of("## Design context", "## Layout structure", "## Structural analysis",
                "## Text content", "## Spatial groupings", "## Nodes", "## Task")) {
            assertTrue(prompt.contains(heading), "missing " + heading);
        }
    }

    @Test
    @DisplayName("Design context reports the inferred payment purpose")
    void designContext() {
        String context = GroupingPromptBuilder.designContext(descriptors);

        assertTrue(context.contains("Inferred design type: PAYMENT"));
        assertTrue(context.contains("Confidence: High"));
    }

    @Test
    @DisplayName("Node listing shows ids, geometry and text")
    void nodeListing() {
        String listing = GroupingPromptBuilder.nodeListing(descriptors);

        assertTrue(listing.contains("- id=1:9 TEXT \"Total\" 150x24 at (16, 420) text:\"Total: $96\""));
    }

    @Test
    @DisplayName("Node listing stops at fifty entries")
    void nodeListingCapped() {
        var many = new ArrayList<ComponentDescriptor>();
        for (int i = 0; i < 60; i++) {
            many.add(at("n" + i, i, i));
        }

        String listing = GroupingPromptBuilder.nodeListing(many);

        assertEquals(GroupingPromptBuilder.MAX_LISTED_NODES, listing.split("\n").length);
        assertFalse(listing.contains("id=n50 "));
    }

    @Test
    @DisplayName("A design without text says so")
    void noTextContent() {
        assertEquals("No text content found in design.\n",
                GroupingPromptBuilder.textContent(List.of(at("a", 0, 0))));
    }

    @Test
    @DisplayName("Whole numbers print without a decimal point")
    void formatsNumbers() {
        assertEquals("16", GroupingPromptBuilder.fmt(16.0));
        assertEquals("12.5", GroupingPromptBuilder.fmt(12.5));
        assertEquals("0.3", GroupingPromptBuilder.fmt(0.333));
    }
}
