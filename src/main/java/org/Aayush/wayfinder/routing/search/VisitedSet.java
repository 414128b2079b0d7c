package org.Aayush.wayfinder.routing.search;

import java.util.BitSet;

/**
 * Tracks which nodes a search has already reached.
 * <p>
 * Wraps a {@link BitSet}: O(1) access, about one bit per node.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. Each search call allocates its own instance.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param nodeCount number of nodes in the searched graph.
     */
    public VisitedSet(int nodeCount) {
        this.visited = new BitSet(nodeCount);
    }

    /**
     * Marks a node as visited if it hasn't been visited already.
     *
     * @param nodeId node index.
     * @return {@code true} if the node was NOT previously visited.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    /**
     * Number of nodes marked so far.
     */
    public int count() {
        return visited.cardinality();
    }
}
