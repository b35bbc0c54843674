package co.fanki.diagrameditor.dialect.domain.basic;

import co.fanki.diagrameditor.dialect.domain.DiagramReader;
import co.fanki.diagrameditor.dialect.domain.DiagramType;
import co.fanki.diagrameditor.shared.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads context and container diagrams.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class C4DiagramReader implements DiagramReader<C4Diagram> {

    private static final String DEFAULT_TYPE = "System";

    private static final Pattern TITLE = Pattern.compile("^title\\s+(.+)$");

    private static final Pattern ELEMENT = Pattern.compile(
            "^(Person|Person_Ext|System|System_Ext|SystemDb|SystemDb_Ext"
                    + "|SystemQueue|Container|Container_Ext|ContainerDb"
                    + "|ContainerQueue|Component|Component_Ext|ComponentDb)"
                    + "\\((\\w+),\\s*\"([^\"]*)\"(?:,\\s*\"([^\"]*)\")?");

    private static final Pattern RELATIONSHIP = Pattern.compile(
            "^(?:Rel|BiRel|Rel_U|Rel_D|Rel_L|Rel_R|Rel_Up|Rel_Down|Rel_Left"
                    + "|Rel_Right|Rel_Back)\\((\\w+),\\s*(\\w+),\\s*"
                    + "\"([^\"]*)\"(?:,\\s*\"([^\"]*)\")?");

    @Override
    public DiagramType type() {
        return DiagramType.C4;
    }

    @Override
    public C4Diagram parse(final String code) {
        final List<String> lines = SourceLines.split(code);
        final List<C4Diagram.Element> elements = new ArrayList<>();
        final List<C4Diagram.Relationship> relationships = new ArrayList<>();
        String title = "";
        for (int i = SourceLines.frontMatterEnd(lines); i < lines.size(); i++) {
            final String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")
                    || trimmed.startsWith("C4")) {
                continue;
            }
            Matcher matcher = TITLE.matcher(trimmed);
            if (matcher.matches()) {
                title = matcher.group(1).trim();
                continue;
            }
            matcher = ELEMENT.matcher(trimmed);
            if (matcher.find()) {
                elements.add(new C4Diagram.Element(matcher.group(1),
                        matcher.group(2), matcher.group(3),
                        matcher.group(4) == null ? "" : matcher.group(4), i));
                continue;
            }
            matcher = RELATIONSHIP.matcher(trimmed);
            if (matcher.find()) {
                relationships.add(new C4Diagram.Relationship(matcher.group(1),
                        matcher.group(2), matcher.group(3),
                        matcher.group(4) == null ? "" : matcher.group(4), i));
            }
        }
        return new C4Diagram(title, List.copyOf(elements),
                List.copyOf(relationships));
    }

    /**
     * Appends an element.
     *
     * @param code the diagram text
     * @param type the macro name, {@code System} when blank
     * @param id the alias
     * @param label the display name
     * @param description the description, may be blank
     * @return the new text
     */
    public String addElement(final String code, final String type,
            final String id, final String label, final String description) {
        final String macro = type == null || type.isBlank()
                ? DEFAULT_TYPE : type.trim();
        final String descriptionPart = description == null || description.isBlank()
                ? "" : ", " + quote(description);
        return SourceLines.append(code, "    " + macro + "(" + id + ", "
                + quote(label) + descriptionPart + ")");
    }

    /**
     * Appends a relationship.
     *
     * @param code the diagram text
     * @param source the source alias
     * @param target the target alias
     * @param label the label
     * @return the new text
     */
    public String addRelationship(final String code, final String source,
            final String target, final String label) {
        return SourceLines.append(code, "    Rel(" + source + ", " + target
                + ", " + quote(label) + ")");
    }

    private static String quote(final String value) {
        return "\"" + (value == null ? "" : value.replace("\"", "'")) + "\"";
    }

}
