package solidrail.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable parse tree node.
 *
 * <p>Leaf kinds carry a {@code value} and no children; every other kind carries an
 * ordered, dense list of children (absent optional slots are omitted, never null).
 * The position may be null for synthesized nodes.
 */
public record Node(
        NodeKind kind,
        List<Node> children,
        Object value,
        Position position
) {

    public Node {
        if (kind == null) throw new IllegalArgumentException("Node kind is required");
        children = List.copyOf(children);
        if (kind.isLeaf() && !children.isEmpty()) {
            throw new IllegalArgumentException(kind + " is a leaf kind and cannot have children");
        }
    }

    public static Node leaf(NodeKind kind, Object value, Position position) {
        return new Node(kind, List.of(), value, position);
    }

    public static Node of(NodeKind kind, Position position, List<Node> children) {
        return new Node(kind, children, null, position);
    }

    public static Node of(NodeKind kind, Position position, Node... children) {
        return new Node(kind, List.of(children), null, position);
    }

    public static Node named(NodeKind kind, String name, Position position, List<Node> children) {
        return new Node(kind, children, name, position);
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /** Value as text; names, operators and string literals are stored as strings. */
    public String text() {
        return value == null ? null : value.toString();
    }

    /** Children of {@code kind}, in order. */
    public List<Node> childrenOf(NodeKind k) {
        List<Node> out = new ArrayList<>();
        for (Node c : children) {
            if (c.kind == k) out.add(c);
        }
        return out;
    }

    /**
     * Depth-first, pre-order search over this node and all of its descendants.
     * Every call starts a fresh traversal.
     */
    public List<Node> findNodes(NodeKind k) {
        List<Node> out = new ArrayList<>();
        collect(this, k, out);
        return out;
    }

    private static void collect(Node n, NodeKind k, List<Node> out) {
        if (n.kind == k) out.add(n);
        for (Node c : n.children) collect(c, k, out);
    }

    /** Position prefix for diagnostics, empty when unknown. */
    public String where() {
        return position == null ? "" : position + " ";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (value != null) sb.append('(').append(value).append(')');
        if (!children.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
