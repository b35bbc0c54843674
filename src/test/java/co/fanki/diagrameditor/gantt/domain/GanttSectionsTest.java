package co.fanki.diagrameditor.gantt.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link GanttSections}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GanttSectionsTest {

    private static final String CHART = String.join("\n",
            "gantt",
            "    title T",
            "    section Build",
            "    A :a1, 2026-01-01, 2d",
            "    B :b1, after a1, 1d",
            "",
            "    section Ship",
            "    C :c1, after b1, 1d");

    @Test
    void whenListing_givenTwoSections_shouldReturnNamesAndLines() {
        assertEquals(List.of(new GanttSections.Section("Build", 2),
                new GanttSections.Section("Ship", 6)),
                GanttSections.list(CHART));
    }

    @Test
    void whenRenaming_givenNameInOtherCase_shouldRenameHeader() {
        final String result = GanttSections.rename(CHART, "build", "Make");

        assertEquals("    section Make", result.split("\n")[2]);
    }

    @Test
    void whenRenaming_givenUnknownSection_shouldReturnTextUnchanged() {
        assertEquals(CHART, GanttSections.rename(CHART, "Nope", "Make"));
    }

    @Test
    void whenAdding_givenNewName_shouldAppendHeaderAfterBlankLine() {
        assertEquals(CHART + "\n\n    section QA",
                GanttSections.add(CHART, "QA"));
    }

    @Test
    void whenAdding_givenExistingName_shouldReturnTextUnchanged() {
        assertEquals(CHART, GanttSections.add(CHART, "ship"));
    }

    @Test
    void whenMovingTask_givenLaterSection_shouldAppendToThatSection() {
        assertEquals(String.join("\n",
                "gantt",
                "    title T",
                "    section Build",
                "    B :b1, after a1, 1d",
                "",
                "    section Ship",
                "    C :c1, after b1, 1d",
                "    A :a1, 2026-01-01, 2d"),
                GanttSections.moveTask(CHART, "a1", "Ship"));
    }

    @Test
    void whenMovingTask_givenEarlierSection_shouldInsertBeforeTheBlankLine() {
        assertEquals(String.join("\n",
                "gantt",
                "    title T",
                "    section Build",
                "    A :a1, 2026-01-01, 2d",
                "    B :b1, after a1, 1d",
                "    C :c1, after b1, 1d",
                "",
                "    section Ship"),
                GanttSections.moveTask(CHART, "c1", "Build"));
    }

    @Test
    void whenMovingTask_givenBlankSection_shouldMoveAboveFirstSection() {
        final String result = GanttSections.moveTask(CHART, "C", "");

        assertEquals("    C :c1, after b1, 1d", result.split("\n")[2]);
        assertNull(GanttParser.parse(result).tasks().get(0).section());
    }

    @Test
    void whenMovingTask_givenMissingSection_shouldCreateIt() {
        final String result = GanttSections.moveTask(CHART, "a1", "Later");

        assertEquals(String.join("\n",
                "",
                "    section Later",
                "    A :a1, 2026-01-01, 2d"),
                result.substring(result.indexOf("    C :c1, after b1, 1d")
                        + "    C :c1, after b1, 1d".length() + 1));
        assertEquals("Later", GanttParser.parse(result).tasks().get(2)
                .section());
    }

    @Test
    void whenMovingTask_givenSameSection_shouldReturnTextUnchanged() {
        assertEquals(CHART, GanttSections.moveTask(CHART, "a1", "build"));
    }

}
