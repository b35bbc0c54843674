package co.fanki.diagrameditor.dialect.domain;

import co.fanki.diagrameditor.dialect.domain.basic.C4DiagramReader;
import co.fanki.diagrameditor.dialect.domain.basic.GitGraphReader;
import co.fanki.diagrameditor.dialect.domain.basic.MindmapReader;
import co.fanki.diagrameditor.dialect.domain.basic.PieChartReader;
import co.fanki.diagrameditor.dialect.domain.basic.QuadrantChartReader;
import co.fanki.diagrameditor.dialect.domain.basic.TimelineReader;
import co.fanki.diagrameditor.dialect.domain.classdiagram.ClassDiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.er.ErDiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.flowchart.FlowchartAdapter;
import co.fanki.diagrameditor.dialect.domain.sequence.SequenceDiagramAdapter;
import co.fanki.diagrameditor.dialect.domain.state.StateDiagramAdapter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup from diagram type to its reader and, for editable
 * dialects, its adapter.
 *
 * <p>Every adapter is also registered as a reader. Types with a reader but
 * no adapter are parse-only.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DiagramAdapterRegistry {

    private static final Map<DiagramType, DiagramReader<?>> READERS =
            new EnumMap<>(DiagramType.class);

    private static final Map<DiagramType, DiagramAdapter<?>> ADAPTERS =
            new EnumMap<>(DiagramType.class);

    static {
        register(new FlowchartAdapter());
        register(new ClassDiagramAdapter());
        register(new ErDiagramAdapter());
        register(new StateDiagramAdapter());
        register(new SequenceDiagramAdapter());

        register(new PieChartReader());
        register(new MindmapReader());
        register(new TimelineReader());
        register(new C4DiagramReader());
        register(new GitGraphReader());
        register(new QuadrantChartReader());
    }

    private DiagramAdapterRegistry() {
    }

    private static void register(final DiagramReader<?> reader) {
        READERS.put(reader.type(), reader);
        if (reader instanceof DiagramAdapter<?> adapter) {
            ADAPTERS.put(adapter.type(), adapter);
        }
    }

    /**
     * Returns the reader of a diagram type.
     *
     * @param type the diagram type
     * @return the reader, empty when the type cannot be parsed
     */
    public static Optional<DiagramReader<?>> reader(final DiagramType type) {
        return Optional.ofNullable(READERS.get(type));
    }

    /**
     * Returns the adapter of a diagram type.
     *
     * @param type the diagram type
     * @return the adapter, empty for parse-only and unknown types
     */
    public static Optional<DiagramAdapter<?>> adapter(final DiagramType type) {
        return Optional.ofNullable(ADAPTERS.get(type));
    }

    /**
     * Checks whether a diagram type supports structural edits.
     *
     * @param type the diagram type
     * @return true when an adapter is registered
     */
    public static boolean isEditable(final DiagramType type) {
        return ADAPTERS.containsKey(type);
    }

    /** @return the types that can be parsed */
    public static Set<DiagramType> parseableTypes() {
        return Collections.unmodifiableSet(READERS.keySet());
    }

    /** @return the types that can be edited */
    public static Set<DiagramType> editableTypes() {
        return Collections.unmodifiableSet(ADAPTERS.keySet());
    }

}
