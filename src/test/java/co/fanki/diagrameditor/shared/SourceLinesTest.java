package co.fanki.diagrameditor.shared;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SourceLines}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceLinesTest {

    @Test
    void whenSplittingAndJoining_givenTrailingNewline_shouldRestoreText() {
        final String code = "flowchart TD\n    A --> B\n";

        final List<String> lines = SourceLines.split(code);

        assertEquals(3, lines.size());
        assertEquals("", lines.get(2));
        assertEquals(code, SourceLines.join(lines));
    }

    @Test
    void whenSplitting_givenNull_shouldReturnOneEmptyLine() {
        assertEquals(List.of(""), SourceLines.split(null));
    }

    @Test
    void whenReadingIndent_givenTabsAndSpaces_shouldReturnThem() {
        assertEquals("\t  ", SourceLines.indentOf("\t  A --> B"));
        assertEquals("", SourceLines.indentOf("A"));
    }

    @Test
    void whenFindingEndOfContent_givenTrailers_shouldStopAboveThem() {
        final List<String> lines = List.of("flowchart TD", "    A --> B",
                "    style A fill:#f00", "", "");

        final int end = SourceLines.endOfContent(lines,
                t -> t.startsWith("style "));

        assertEquals(2, end);
    }

    @Test
    void whenFindingFrontMatter_givenClosedBlock_shouldSkipIt() {
        final List<String> lines = List.of("---", "title: Plan", "---",
                "gantt");

        assertEquals(3, SourceLines.frontMatterEnd(lines));
        assertEquals(0, SourceLines.frontMatterEnd(List.of("gantt")));
        assertEquals(1, SourceLines.frontMatterEnd(List.of("---", "gantt")));
    }

    @Test
    void whenRemovingLines_givenIndexes_shouldDropOnlyThose() {
        assertEquals("a\nc", SourceLines.removeLines("a\nb\nc", Set.of(1, 7)));
    }

    @Test
    void whenRemovingLines_givenNothing_shouldReturnSameText() {
        final String code = "a\nb";

        assertSame(code, SourceLines.removeLines(code, Set.of()));
    }

    @Test
    void whenAppending_givenTrailingNewline_shouldReuseIt() {
        assertEquals("a\nb", SourceLines.append("a\n", "b"));
        assertEquals("a\nb", SourceLines.append("a", "b"));
        assertEquals("b", SourceLines.append(null, "b"));
    }

    @Test
    void whenEscaping_givenQuotesAndBackslashes_shouldEscapeBoth() {
        assertEquals("say \\\"hi\\\" \\\\o/",
                SourceLines.escapeQuotes("say \"hi\" \\o/"));
        assertTrue(SourceLines.escapeQuotes(null).isEmpty());
        assertFalse(SourceLines.escapeQuotes("plain").contains("\\"));
    }

}
