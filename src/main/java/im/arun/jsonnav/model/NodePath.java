package im.arun.jsonnav.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Location of a node from the document root, used as node identity, cache key
 * and search index key.
 *
 * <p>Paths share their prefix with the parent path, so building a child path is
 * O(1) regardless of depth. Two paths are equal iff their segment sequences are equal.
 * The empty path denotes the root.
 */
public final class NodePath {
    private static final NodePath ROOT = new NodePath(null, null);
    private static final Pattern SIMPLE_NAME = Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*$");

    private final NodePath parent;
    private final PathSegment segment;
    private final int depth;
    private final int hash;

    private NodePath(NodePath parent, PathSegment segment) {
        this.parent = parent;
        this.segment = segment;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.hash = parent == null ? 1 : 31 * parent.hash + segment.hashCode();
    }

    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(PathSegment... segments) {
        NodePath path = ROOT;
        for (PathSegment segment : segments) {
            path = path.child(segment);
        }
        return path;
    }

    public NodePath child(PathSegment segment) {
        if (segment == null) {
            throw new IllegalArgumentException("Segment must not be null");
        }
        return new NodePath(this, segment);
    }

    public NodePath child(String name) {
        return child(PathSegment.name(name));
    }

    public NodePath child(int index) {
        return child(PathSegment.index(index));
    }

    /**
     * Parent path, or {@code null} for the root.
     */
    public NodePath parent() {
        return parent;
    }

    public PathSegment lastSegment() {
        return segment;
    }

    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public List<PathSegment> segments() {
        List<PathSegment> result = new ArrayList<>(depth);
        for (NodePath p = this; p.segment != null; p = p.parent) {
            result.add(p.segment);
        }
        Collections.reverse(result);
        return result;
    }

    /**
     * True when this path is a proper or improper prefix of {@code other}.
     */
    public boolean isAncestorOf(NodePath other) {
        if (other == null || other.depth < depth) {
            return false;
        }
        NodePath p = other;
        while (p.depth > depth) {
            p = p.parent;
        }
        return p.equals(this);
    }

    /**
     * Renders the path as a JSONPath expression such as {@code $.store.items[3]['a key']}.
     */
    public String toJsonPath() {
        StringBuilder sb = new StringBuilder("$");
        for (PathSegment s : segments()) {
            if (s.isIndex()) {
                sb.append('[').append(s.getIndex()).append(']');
            } else if (SIMPLE_NAME.matcher(s.getName()).matches()) {
                sb.append('.').append(s.getName());
            } else {
                sb.append("['");
                for (char c : s.getName().toCharArray()) {
                    if (c == '\'' || c == '\\') {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
                sb.append("']");
            }
        }
        return sb.toString();
    }

    /**
     * Parses a JSONPath expression produced by {@link #toJsonPath()}. Also accepts
     * double-quoted bracket names. Wildcards, slices and filters are rejected.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static NodePath parse(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Path expression must not be null");
        }
        String expr = expression.trim();
        if (expr.isEmpty() || expr.equals("$")) {
            return ROOT;
        }
        if (expr.charAt(0) != '$') {
            throw new IllegalArgumentException("Path expression must start with '$': " + expression);
        }

        NodePath path = ROOT;
        int i = 1;
        while (i < expr.length()) {
            char c = expr.charAt(i);
            if (c == '.') {
                int start = ++i;
                while (i < expr.length() && expr.charAt(i) != '.' && expr.charAt(i) != '[') {
                    i++;
                }
                if (start == i) {
                    throw new IllegalArgumentException("Empty property name at offset " + start + ": " + expression);
                }
                path = path.child(expr.substring(start, i));
            } else if (c == '[') {
                i++;
                if (i >= expr.length()) {
                    throw new IllegalArgumentException("Unterminated bracket: " + expression);
                }
                char q = expr.charAt(i);
                if (q == '\'' || q == '"') {
                    StringBuilder name = new StringBuilder();
                    i++;
                    boolean closed = false;
                    while (i < expr.length()) {
                        char ch = expr.charAt(i);
                        if (ch == '\\' && i + 1 < expr.length()) {
                            name.append(expr.charAt(i + 1));
                            i += 2;
                        } else if (ch == q) {
                            closed = true;
                            i++;
                            break;
                        } else {
                            name.append(ch);
                            i++;
                        }
                    }
                    if (!closed || i >= expr.length() || expr.charAt(i) != ']') {
                        throw new IllegalArgumentException("Unterminated quoted name: " + expression);
                    }
                    i++;
                    path = path.child(name.toString());
                } else {
                    int start = i;
                    while (i < expr.length() && Character.isDigit(expr.charAt(i))) {
                        i++;
                    }
                    if (start == i || i >= expr.length() || expr.charAt(i) != ']') {
                        throw new IllegalArgumentException("Invalid array index at offset " + start + ": " + expression);
                    }
                    try {
                        path = path.child(Integer.parseInt(expr.substring(start, i)));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Array index out of range: " + expression, e);
                    }
                    i++;
                }
            } else {
                throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + i + ": " + expression);
            }
        }
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodePath)) {
            return false;
        }
        NodePath a = this;
        NodePath b = (NodePath) o;
        if (a.depth != b.depth || a.hash != b.hash) {
            return false;
        }
        while (a != null && a != b) {
            if (!a.segment.equals(b.segment)) {
                return false;
            }
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toJsonPath();
    }
}
