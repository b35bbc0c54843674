package co.fanki.diagrameditor.flowchart.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowchartStyleSheet}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowchartStyleSheetTest {

    private static final String CHART = String.join("\n",
            "flowchart TD",
            "    A:::hot --> B",
            "    classDef hot fill:#f00,stroke:#333;",
            "    classDef cold,ice fill:#00f",
            "    style A stroke:#000",
            "    class B cold");

    @Test
    void whenParsing_givenClassDefinitions_shouldSplitNames() {
        final FlowchartStyleSheet styles = FlowchartStyleSheet.parse(CHART);

        assertEquals(3, styles.classDefs().size());
        assertEquals("#333", styles.classDef("hot").properties().get("stroke"));
        assertEquals("#00f", styles.classDef("ice").properties().get("fill"));
        assertEquals(3, styles.classDef("cold").lineIndex());
        assertNull(styles.classDef("missing"));
    }

    @Test
    void whenParsing_givenInlineAndLineAssignments_shouldRecordBoth() {
        final FlowchartStyleSheet styles = FlowchartStyleSheet.parse(CHART);

        assertEquals(Map.of("A", "hot", "B", "cold"),
                styles.classAssignments());
    }

    @Test
    void whenComputingEffectiveStyle_givenOwnStyle_shouldOverrideClass() {
        final FlowchartStyleSheet styles = FlowchartStyleSheet.parse(CHART);

        assertEquals(Map.of("fill", "#f00", "stroke", "#000"),
                styles.effectiveStyle("A"));
        assertEquals(Map.of("fill", "#00f"), styles.effectiveStyle("B"));
        assertTrue(styles.effectiveStyle("C").isEmpty());
    }

    @Test
    void whenSplittingProperties_givenSemicolons_shouldIgnoreEmptyPairs() {
        final Map<String, String> properties =
                FlowchartStyleSheet.properties("fill:#f9f;stroke:#333;; junk");

        assertEquals(Map.of("fill", "#f9f", "stroke", "#333"), properties);
    }

}
