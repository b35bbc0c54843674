package co.fanki.diagrameditor.dialect.domain.er;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between SQL DDL and entity relationship diagrams.
 *
 * <p>Import reads {@code CREATE TABLE} statements: columns become
 * attributes with simplified types, and every foreign key becomes a
 * <code>}o--||</code> relationship to the referenced table. Export writes
 * PostgreSQL DDL, one table per entity that has attributes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ErSqlConverter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ErSqlConverter.class);

    private static final Pattern TABLE = Pattern.compile(
            "CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?[\"`]?(\\w+)[\"`]?"
                    + "\\s*\\(([\\s\\S]*?)\\)\\s*;",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PRIMARY_KEY = Pattern.compile(
            "PRIMARY\\s+KEY\\s*\\(([^)]+)\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern FOREIGN_KEY = Pattern.compile(
            "FOREIGN\\s+KEY\\s*\\(([^)]+)\\)\\s*REFERENCES\\s+[\"`]?(\\w+)[\"`]?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern INLINE_REFERENCE = Pattern.compile(
            "\\bREFERENCES\\s+[\"`]?(\\w+)[\"`]?", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONSTRAINT_LINE = Pattern.compile(
            "^(PRIMARY\\s+KEY|FOREIGN\\s+KEY|UNIQUE|CHECK|CONSTRAINT|INDEX)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern COLUMN = Pattern.compile(
            "^[\"`]?(\\w+)[\"`]?\\s+(\\w+(?:\\s*\\([^)]*\\))?)");

    private static final Pattern INLINE_PRIMARY_KEY = Pattern.compile(
            "\\bPRIMARY\\s+KEY\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern UNIQUE = Pattern.compile(
            "\\bUNIQUE\\b", Pattern.CASE_INSENSITIVE);

    private static final String CARDINALITY = "}o--||";

    private static final String LABEL = "references";

    private static final Map<String, String> SQL_TYPES = Map.of(
            "string", "VARCHAR(255)",
            "int", "INTEGER",
            "float", "NUMERIC",
            "boolean", "BOOLEAN",
            "datetime", "TIMESTAMP",
            "date", "DATE",
            "json", "JSONB",
            "text", "TEXT");

    private ErSqlConverter() {
    }

    /**
     * Builds an ER diagram from {@code CREATE TABLE} statements.
     *
     * <p>Table names are upper-cased and column names lower-cased. A
     * relationship is written once per pair of tables.</p>
     *
     * @param sql the DDL
     * @return the diagram text, empty when the text has no table
     */
    public static String toErDiagram(final String sql) {
        if (sql == null) {
            return "";
        }
        final List<String> lines = new ArrayList<>();
        final Set<String> relationships = new LinkedHashSet<>();
        final Matcher table = TABLE.matcher(sql);
        while (table.find()) {
            final String name = table.group(1).toUpperCase(Locale.ROOT);
            final String body = table.group(2);

            final Set<String> primaryKeys = new LinkedHashSet<>();
            final Matcher pk = PRIMARY_KEY.matcher(body);
            while (pk.find()) {
                for (final String column : pk.group(1).split(",")) {
                    primaryKeys.add(unquote(column));
                }
            }
            final Map<String, String> foreignKeys = new LinkedHashMap<>();
            final Matcher fk = FOREIGN_KEY.matcher(body);
            while (fk.find()) {
                foreignKeys.put(unquote(fk.group(1)),
                        fk.group(2).toUpperCase(Locale.ROOT));
            }

            lines.add("    " + name + " {");
            for (final String definition : splitTopLevel(body)) {
                if (CONSTRAINT_LINE.matcher(definition).find()) {
                    continue;
                }
                final Matcher column = COLUMN.matcher(definition);
                if (!column.find()) {
                    continue;
                }
                final String columnName = column.group(1).toLowerCase(Locale.ROOT);
                final Optional<String> inline = inlineReference(definition);
                inline.ifPresent(target -> foreignKeys.putIfAbsent(columnName,
                        target));
                final String constraint;
                if (primaryKeys.contains(columnName)
                        || INLINE_PRIMARY_KEY.matcher(definition).find()) {
                    constraint = " PK";
                } else if (foreignKeys.containsKey(columnName)) {
                    constraint = " FK";
                } else if (UNIQUE.matcher(definition).find()) {
                    constraint = " UK";
                } else {
                    constraint = "";
                }
                lines.add("        " + erType(column.group(2)) + " "
                        + columnName + constraint);
            }
            lines.add("    }");
            for (final String target : foreignKeys.values()) {
                relationships.add("    " + name + " " + CARDINALITY + " "
                        + target + " : " + LABEL);
            }
        }
        if (lines.isEmpty()) {
            LOG.debug("No CREATE TABLE statement found");
            return "";
        }
        final List<String> out = new ArrayList<>();
        out.add("erDiagram");
        out.addAll(lines);
        out.addAll(relationships);
        return String.join("\n", out);
    }

    /**
     * Writes PostgreSQL DDL for the entities of a diagram.
     *
     * <p>Types outside the simplified set are upper-cased as written. A
     * foreign key column references the related entity whose name it
     * starts with, such as {@code customer_id} for {@code CUSTOMER}, or
     * else the first entity related to its table.</p>
     *
     * @param diagram the parsed diagram
     * @return the statements separated by a blank line, empty when no
     *         entity has attributes
     */
    public static String toSql(final ErDiagram diagram) {
        final List<String> statements = new ArrayList<>();
        for (final ErDiagram.Entity entity : diagram.entities()) {
            if (entity.attributes().isEmpty()) {
                continue;
            }
            final List<String> definitions = new ArrayList<>();
            final List<String> primaryKeys = new ArrayList<>();
            final List<String> foreignKeys = new ArrayList<>();
            for (final ErDiagram.Attribute attribute : entity.attributes()) {
                final String type = SQL_TYPES.getOrDefault(
                        attribute.type().toLowerCase(Locale.ROOT),
                        attribute.type().toUpperCase(Locale.ROOT));
                final StringBuilder definition = new StringBuilder("    ")
                        .append(attribute.name()).append(' ').append(type);
                if ("PK".equals(attribute.constraint())) {
                    definition.append(" NOT NULL");
                    primaryKeys.add(attribute.name());
                } else if ("UK".equals(attribute.constraint())) {
                    definition.append(" UNIQUE");
                } else if ("FK".equals(attribute.constraint())) {
                    foreignKeys.add(attribute.name());
                }
                definitions.add(definition.toString());
            }
            if (!primaryKeys.isEmpty()) {
                definitions.add("    PRIMARY KEY (" + String.join(", ",
                        primaryKeys) + ")");
            }
            final List<String> related = related(diagram, entity.id());
            for (final String column : foreignKeys) {
                referenced(related, column).ifPresent(target ->
                        definitions.add("    FOREIGN KEY (" + column
                                + ") REFERENCES "
                                + target.toLowerCase(Locale.ROOT) + " (id)"));
            }
            statements.add("CREATE TABLE " + entity.id().toLowerCase(Locale.ROOT)
                    + " (\n" + String.join(",\n", definitions) + "\n);");
        }
        return String.join("\n\n", statements);
    }

    /** Maps a SQL column type to the simplified ER type. */
    static String erType(final String sqlType) {
        final String type = sqlType.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "");
        if (type.matches("^(varchar|char|text|clob|nvarchar|nchar|ntext|uuid).*")) {
            return "string";
        }
        if (type.matches("^(int|integer|bigint|smallint|tinyint|serial|bigserial).*")) {
            return "int";
        }
        if (type.matches("^(float|double|decimal|numeric|real).*")) {
            return "float";
        }
        if (type.matches("^(bool|boolean).*")) {
            return "boolean";
        }
        if (type.matches("^(date|timestamp|datetime|time).*")) {
            return "datetime";
        }
        if (type.matches("^(json|jsonb).*")) {
            return "json";
        }
        return type;
    }

    /** Splits a table body on the commas outside parentheses. */
    private static List<String> splitTopLevel(final String body) {
        final List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            final char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(body.substring(start).trim());
        parts.removeIf(String::isEmpty);
        return parts;
    }

    private static Optional<String> inlineReference(final String definition) {
        final Matcher matcher = INLINE_REFERENCE.matcher(definition);
        return matcher.find()
                ? Optional.of(matcher.group(1).toUpperCase(Locale.ROOT))
                : Optional.empty();
    }

    private static String unquote(final String column) {
        return column.trim().replaceAll("[\"`]", "").toLowerCase(Locale.ROOT);
    }

    private static List<String> related(final ErDiagram diagram,
            final String entity) {
        final List<String> related = new ArrayList<>();
        for (final ErDiagram.Relationship relationship : diagram.relationships()) {
            final String other;
            if (relationship.source().equals(entity)) {
                other = relationship.target();
            } else if (relationship.target().equals(entity)) {
                other = relationship.source();
            } else {
                continue;
            }
            if (!other.equals(entity) && !related.contains(other)) {
                related.add(other);
            }
        }
        return related;
    }

    private static Optional<String> referenced(final List<String> related,
            final String column) {
        final String lower = column.toLowerCase(Locale.ROOT);
        return related.stream()
                .filter(other -> lower.startsWith(
                        other.toLowerCase(Locale.ROOT)))
                .findFirst()
                .or(() -> related.stream().findFirst());
    }

}
