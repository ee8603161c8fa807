package solidrail.codegen;

import solidrail.ast.Node;
import solidrail.ast.NodeKind;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Doc-comment tags attached to a method definition.
 *
 * <pre>
 * # @param to [Address] recipient
 * # @return [Boolean]
 * # @view
 * def transfer(to, amount)
 * </pre>
 */
final class DocTags {
    private static final Pattern PARAM = Pattern.compile("@param\\s+(\\w+)\\s*\\[([^\\]]+)]");
    private static final Pattern PARAM_TYPE_FIRST = Pattern.compile("@param\\s*\\[([^\\]]+)]\\s*(\\w+)");
    private static final Pattern RETURN = Pattern.compile("@return\\s*\\[([^\\]]+)]");
    private static final Pattern MARKER = Pattern.compile("@(\\w+)\\s*$");

    private final Map<String, String> paramTypes = new LinkedHashMap<>();
    private final Set<String> markers = new LinkedHashSet<>();
    private String returnType;

    private DocTags() {}

    static DocTags of(Node methodDef) {
        DocTags tags = new DocTags();
        for (Node tag : methodDef.childrenOf(NodeKind.DOC_TAG)) {
            tags.add(tag.text().trim());
        }
        return tags;
    }

    private void add(String text) {
        Matcher m = PARAM.matcher(text);
        if (m.lookingAt()) {
            paramTypes.put(m.group(1), m.group(2).trim());
            return;
        }
        m = PARAM_TYPE_FIRST.matcher(text);
        if (m.lookingAt()) {
            paramTypes.put(m.group(2), m.group(1).trim());
            return;
        }
        m = RETURN.matcher(text);
        if (m.lookingAt()) {
            returnType = m.group(1).trim();
            return;
        }
        m = MARKER.matcher(text);
        if (m.matches()) markers.add(m.group(1));
    }

    String paramType(String name) {
        return paramTypes.get(name);
    }

    String returnType() {
        return returnType;
    }

    Set<String> markers() {
        return markers;
    }

    /** Visibility written as a tag ({@code @private}), or null. */
    String visibility() {
        for (String v : new String[] {"private", "protected", "public"}) {
            if (markers.contains(v)) return v;
        }
        return null;
    }
}
