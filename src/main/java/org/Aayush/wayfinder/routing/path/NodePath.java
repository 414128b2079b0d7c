package org.Aayush.wayfinder.routing.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Ordered node sequence from a start node to an end node, both inclusive.
 * An empty path means no path exists.
 */
public final class NodePath {
    private static final NodePath EMPTY = new NodePath(IntLists.emptyList());

    private final IntList nodes;

    private NodePath(IntList nodes) {
        this.nodes = nodes;
    }

    public static NodePath empty() {
        return EMPTY;
    }

    public static NodePath of(int... nodes) {
        if (nodes.length == 0) {
            return EMPTY;
        }
        return new NodePath(IntLists.unmodifiable(new IntArrayList(nodes)));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Number of nodes, including both endpoints.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Number of edges walked; 0 for empty and single-node paths.
     */
    public int hopCount() {
        return Math.max(0, nodes.size() - 1);
    }

    public int nodeAt(int position) {
        return nodes.getInt(position);
    }

    public int first() {
        return nodes.getInt(0);
    }

    public int last() {
        return nodes.getInt(nodes.size() - 1);
    }

    public int[] toArray() {
        return nodes.toIntArray();
    }

    /**
     * Renders the path with {@code separator} between node labels.
     */
    public String format(IntFunction<String> label, String separator) {
        Objects.requireNonNull(label, "label");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(label.apply(nodes.getInt(i)));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodePath)) return false;
        return nodes.equals(((NodePath) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "NodePath" + nodes;
    }
}
