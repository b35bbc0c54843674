package co.fanki.diagrameditor.dialect.domain.er;

import co.fanki.diagrameditor.dialect.domain.DiagramLink;
import co.fanki.diagrameditor.dialect.domain.DiagramModel;
import co.fanki.diagrameditor.dialect.domain.DiagramNode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A parsed entity relationship diagram.
 *
 * @param entities the entities, declared ones first
 * @param relationships the relationships in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ErDiagram(List<Entity> entities,
        List<Relationship> relationships) implements DiagramModel {

    /**
     * An entity.
     *
     * @param id the entity name
     * @param attributes the attributes of its block
     * @param lineIndex the line that opens its block, -1 when the entity
     *        is only named by relationships
     * @param endLine the closing brace line, -1 when not declared
     */
    public record Entity(String id, List<Attribute> attributes,
            int lineIndex, int endLine) {

        /** @return true when the entity has its own block */
        public boolean isDeclared() {
            return lineIndex >= 0;
        }
    }

    /**
     * An attribute line such as {@code string email UK "login"}.
     *
     * @param type the attribute type
     * @param name the attribute name
     * @param constraint PK, FK or UK, null when absent
     * @param raw the line as written, trimmed
     */
    public record Attribute(String type, String name, String constraint,
            String raw) {

        private static final List<String> CONSTRAINTS = List.of("PK", "FK", "UK");

        /**
         * Parses an attribute line.
         *
         * @param raw the trimmed line
         * @return the attribute; a single word is taken as the type with
         *         an empty name
         */
        public static Attribute parse(final String raw) {
            final String[] parts = raw.trim().split("\\s+");
            final String type = parts[0];
            final String name = parts.length > 1 ? parts[1] : "";
            String constraint = null;
            if (parts.length > 2) {
                final String candidate = parts[2].replace(",", "")
                        .toUpperCase(Locale.ROOT);
                if (CONSTRAINTS.contains(candidate)) {
                    constraint = candidate;
                }
            }
            return new Attribute(type, name, constraint, raw.trim());
        }
    }

    /**
     * The two cardinality markers of a relationship.
     *
     * @param source the marker on the left entity, e.g. {@code ||}
     * @param target the marker on the right entity, e.g. <code>o{</code>
     * @param identifying true for {@code --}, false for {@code ..}
     */
    public record Cardinality(String source, String target,
            boolean identifying) {

        /**
         * Splits a connector such as <code>||--o{</code>.
         *
         * @param connector the connector as written
         * @return the markers, {@code ||} and <code>o{</code> when a side is
         *         missing
         */
        public static Cardinality parse(final String connector) {
            final String compact = connector.replaceAll("\\s+", "");
            int split = compact.indexOf("--");
            boolean identifying = true;
            if (split < 0) {
                split = compact.indexOf("..");
                identifying = false;
            }
            if (split < 0) {
                return new Cardinality("||", "o{", true);
            }
            final String left = compact.substring(0, split);
            final String right = compact.substring(split + 2);
            return new Cardinality(left.isEmpty() ? "||" : left,
                    right.isEmpty() ? "o{" : right, identifying);
        }
    }

    /**
     * A relationship line such as <code>CUSTOMER ||--o{ ORDER : places</code>.
     *
     * @param source the left entity
     * @param target the right entity
     * @param connector the connector as written
     * @param cardinality the parsed markers
     * @param label the label, empty when absent
     * @param lineIndex the line it was found on
     */
    public record Relationship(String source, String target, String connector,
            Cardinality cardinality, String label, int lineIndex) {}

    /**
     * Finds an entity by name.
     *
     * @param id the entity name
     * @return the entity, if present
     */
    public Optional<Entity> find(final String id) {
        return entities.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    @Override
    public List<DiagramNode> elements() {
        return entities.stream()
                .map(e -> new DiagramNode(e.id(), e.id(), "entity",
                        e.lineIndex()))
                .toList();
    }

    @Override
    public List<DiagramLink> connections() {
        return relationships.stream()
                .map(r -> new DiagramLink(r.source(), r.target(),
                        r.connector(), r.label(), r.lineIndex()))
                .toList();
    }

}
