package solidrail.cli;

import solidrail.ast.Node;

/**
 * Indented dump of a parse tree, one node per line:
 * {@code KIND value @line:column}.
 */
public final class AstPrinter {
    private final StringBuilder r = new StringBuilder();
    private int indentPos = 0;

    public static String print(Node root) {
        return new AstPrinter().process(root).r.toString();
    }

    private AstPrinter process(Node n) {
        indent();
        r.append(n.kind());
        if (n.value() != null) {
            r.append(' ');
            if (n.value() instanceof String s) r.append('"').append(s).append('"');
            else r.append(n.value());
        }
        if (n.position() != null) {
            r.append(" @").append(n.position().line()).append(':').append(n.position().column());
        }
        r.append('\n');
        indentPos++;
        for (Node c : n.children()) process(c);
        indentPos--;
        return this;
    }

    private void indent() {
        for (int i = 0; i < indentPos; i++) r.append("  ");
    }
}
