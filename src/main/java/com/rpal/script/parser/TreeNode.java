package com.rpal.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable labeled tree node. Used for both the raw tree built by {@link Parser} and the
 * standardized tree built by {@link Standardizer}; children are owned, never shared.
 */
public final class TreeNode {
    public final NodeType type;
    /** Identifier name, integer digits or string text (without quotes); null for operators. */
    public final String value;
    public final List<TreeNode> children;

    private TreeNode(NodeType type, String value, List<TreeNode> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = value;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static TreeNode leaf(NodeType type, String value) {
        if (!type.isLeaf()) throw new IllegalArgumentException("Not a leaf tag: " + type);
        return new TreeNode(type, value, Collections.emptyList());
    }

    public static TreeNode leaf(NodeType type) {
        return leaf(type, null);
    }

    public static TreeNode identifier(String name) {
        return leaf(NodeType.IDENTIFIER, name);
    }

    public static TreeNode integer(long n) {
        return leaf(NodeType.INTEGER, Long.toString(n));
    }

    public static TreeNode string(String text) {
        return leaf(NodeType.STRING, text);
    }

    public static TreeNode of(NodeType type, TreeNode... children) {
        return of(type, Arrays.asList(children));
    }

    public static TreeNode of(NodeType type, List<TreeNode> children) {
        if (type.isLeaf()) throw new IllegalArgumentException("Leaf tag cannot have children: " + type);
        return new TreeNode(type, null, children);
    }

    public TreeNode child(int i) {
        return children.get(i);
    }

    public int arity() {
        return children.size();
    }

    /** Label in the classic RPAL tree-print notation: {@code <ID:x>}, {@code <INT:3>}, {@code gamma}. */
    public String label() {
        switch (type) {
            case IDENTIFIER: return "<ID:" + value + ">";
            case INTEGER:    return "<INT:" + value + ">";
            case STRING:     return "<STR:'" + value + "'>";
            case TRUE: case FALSE: case NIL: case DUMMY: case YSTAR:
                return "<" + type.tag + ">";
            default:
                return type.tag;
        }
    }

    /** Pre-order rendering, one node per line, indented with one dot per level. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append('.');
        sb.append(label()).append('\n');
        for (TreeNode c : children) c.render(sb, depth + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeNode)) return false;
        TreeNode other = (TreeNode) o;
        return type == other.type && Objects.equals(value, other.value) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, children);
    }

    /** Compact one-line form, e.g. {@code gamma(lambda(<ID:X>,<INT:1>),<INT:3>)}. */
    @Override
    public String toString() {
        if (children.isEmpty()) return label();
        StringBuilder sb = new StringBuilder(label()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
