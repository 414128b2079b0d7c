package org.Aayush.wayfinder.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Directed, weighted adjacency-list graph over a fixed number of nodes.
 * <p>
 * Edges are kept in an index-based arena: parallel {@code destination / weight / next} arrays
 * plus a per-node {@code head} pointer. New edges are linked in front of the node's list, so
 * neighbour iteration yields the most recently added edge first. That order decides BFS/DFS
 * tie-breaking and is part of the contract.
 * <p>
 * Instances are created through {@link #builder(int)} and are immutable afterwards. Any number
 * of searches may read the same instance concurrently.
 */
public final class AdjacencyGraph {

    /** Sentinel terminating a node's edge chain. */
    public static final int NO_EDGE = -1;
    /** Weight used when an edge is added without one. */
    public static final int DEFAULT_WEIGHT = 1;

    private final int nodeCount;
    private final int[] head;
    private final int[] outDegree;
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final int[] edgeWeight;
    private final int[] edgeNext;
    private final String[] nodeNames;

    private AdjacencyGraph(Builder builder) {
        this.nodeCount = builder.nodeCount;
        this.head = builder.head.clone();
        this.outDegree = builder.outDegree.clone();
        this.edgeSource = builder.edgeSource.toIntArray();
        this.edgeTarget = builder.edgeTarget.toIntArray();
        this.edgeWeight = builder.edgeWeight.toIntArray();
        this.edgeNext = builder.edgeNext.toIntArray();
        this.nodeNames = builder.nodeNames.clone();
    }

    /**
     * Starts a graph with {@code nodeCount} nodes and no edges, using {@link GraphLimits#defaults()}.
     *
     * @throws IllegalArgumentException when {@code nodeCount} is negative.
     * @throws GraphAllocationException when storage cannot be obtained.
     */
    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount, GraphLimits.defaults());
    }

    /**
     * Starts a graph under explicit storage limits.
     */
    public static Builder builder(int nodeCount, GraphLimits limits) {
        return new Builder(nodeCount, Objects.requireNonNull(limits, "limits"));
    }

    // ========================================================================
    // CORE ACCESSORS
    // ========================================================================

    public int nodeCount() { return nodeCount; }
    public int edgeCount() { return edgeTarget.length; }

    public int edgeSource(int edgeId) {
        checkEdge(edgeId);
        return edgeSource[edgeId];
    }

    public int edgeDestination(int edgeId) {
        checkEdge(edgeId);
        return edgeTarget[edgeId];
    }

    public int edgeWeight(int edgeId) {
        checkEdge(edgeId);
        return edgeWeight[edgeId];
    }

    /**
     * Newest outgoing edge of {@code nodeId}, or {@link #NO_EDGE}.
     */
    public int firstEdge(int nodeId) {
        checkNode(nodeId);
        return head[nodeId];
    }

    /**
     * Edge following {@code edgeId} in its source's chain, or {@link #NO_EDGE}.
     */
    public int nextEdge(int edgeId) {
        checkEdge(edgeId);
        return edgeNext[edgeId];
    }

    public int outDegree(int nodeId) {
        checkNode(nodeId);
        return outDegree[nodeId];
    }

    /**
     * Returns the display name of a node, or {@code null} when none was assigned.
     */
    public String nodeName(int nodeId) {
        checkNode(nodeId);
        return nodeNames[nodeId];
    }

    /**
     * Checks whether at least one edge {@code source -> destination} exists.
     */
    public boolean hasEdge(int source, int destination) {
        checkNode(destination);
        NeighborIterator it = neighbors(source);
        while (it.hasNext()) {
            if (edgeTarget[it.next()] == destination) {
                return true;
            }
        }
        return false;
    }

    /**
     * Smallest weight among the edges {@code source -> destination}.
     *
     * @return the weight, or {@code -1} when no such edge exists.
     */
    public int minEdgeWeight(int source, int destination) {
        checkNode(destination);
        int best = -1;
        NeighborIterator it = neighbors(source);
        while (it.hasNext()) {
            int edgeId = it.next();
            if (edgeTarget[edgeId] == destination && (best < 0 || edgeWeight[edgeId] < best)) {
                best = edgeWeight[edgeId];
            }
        }
        return best;
    }

    /**
     * Throws the bounds error used across the engine for invalid node ids.
     *
     * @throws IndexOutOfBoundsException when {@code nodeId} is outside {@code [0, nodeCount)}.
     */
    public void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
    }

    private void checkEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeTarget.length) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds");
        }
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    /**
     * Creates a reusable iterator. Call {@link NeighborIterator#resetForNode(int)} before use.
     */
    public NeighborIterator iterator() {
        return new NeighborIterator(this);
    }

    /**
     * Creates an iterator positioned on the outgoing edges of {@code nodeId}.
     */
    public NeighborIterator neighbors(int nodeId) {
        return new NeighborIterator(this).resetForNode(nodeId);
    }

    /**
     * Restartable cursor over one node's outgoing edge ids, newest first.
     * Not thread-safe; each search owns its own instance.
     */
    public static final class NeighborIterator {
        private final AdjacencyGraph graph;
        private int current = NO_EDGE;

        NeighborIterator(AdjacencyGraph graph) {
            this.graph = graph;
        }

        public NeighborIterator resetForNode(int nodeId) {
            graph.checkNode(nodeId);
            this.current = graph.head[nodeId];
            return this;
        }

        public boolean hasNext() {
            return current != NO_EDGE;
        }

        /**
         * Advances and returns the next edge id.
         */
        public int next() {
            if (current == NO_EDGE) throw new NoSuchElementException();
            int edgeId = current;
            current = graph.edgeNext[edgeId];
            return edgeId;
        }

        /**
         * Advances and returns the destination node of the next edge.
         */
        public int nextDestination() {
            return graph.edgeTarget[next()];
        }
    }

    // ========================================================================
    // DEBUG
    // ========================================================================

    @Override
    public String toString() {
        return String.format("AdjacencyGraph[nodes=%d, edges=%d, avgDegree=%.2f]",
                nodeCount, edgeCount(), nodeCount > 0 ? (double) edgeCount() / nodeCount : 0);
    }

    public String toDetailedString() {
        if (nodeCount > 50) return toString() + " (too large to detail)";
        StringBuilder sb = new StringBuilder(toString()).append("\n");
        NeighborIterator iter = iterator();
        for (int n = 0; n < nodeCount; n++) {
            if (nodeNames[n] != null) {
                sb.append(String.format("Node %d %s: [", n, nodeNames[n]));
            } else {
                sb.append(String.format("Node %d: [", n));
            }
            iter.resetForNode(n);
            while (iter.hasNext()) {
                int e = iter.next();
                sb.append(String.format("%d->%d(%d)", e, edgeTarget[e], edgeWeight[e]));
                if (iter.hasNext()) sb.append(", ");
            }
            sb.append("]\n");
        }
        return sb.toString();
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Accumulates edges and names, then freezes them into an {@link AdjacencyGraph}.
     * A builder can be built once; further mutation is rejected.
     */
    public static final class Builder {
        private final int nodeCount;
        private final int[] head;
        private final int[] outDegree;
        private final String[] nodeNames;
        private final IntArrayList edgeSource = new IntArrayList();
        private final IntArrayList edgeTarget = new IntArrayList();
        private final IntArrayList edgeWeight = new IntArrayList();
        private final IntArrayList edgeNext = new IntArrayList();
        private boolean built;

        private Builder(int nodeCount, GraphLimits limits) {
            if (nodeCount < 0) {
                throw new IllegalArgumentException("nodeCount must be non-negative: " + nodeCount);
            }
            limits.checkNodeCount(nodeCount);
            this.nodeCount = nodeCount;
            try {
                this.head = new int[nodeCount];
                this.outDegree = new int[nodeCount];
                this.nodeNames = new String[nodeCount];
            } catch (OutOfMemoryError error) {
                throw new GraphAllocationException("cannot allocate adjacency storage for " + nodeCount + " nodes", error);
            }
            Arrays.fill(head, NO_EDGE);
        }

        public int nodeCount() {
            return nodeCount;
        }

        /**
         * Adds {@code source -> destination} with {@link #DEFAULT_WEIGHT}.
         */
        public Builder addEdge(int source, int destination) {
            return addEdge(source, destination, DEFAULT_WEIGHT);
        }

        /**
         * Adds one directed edge in front of {@code source}'s list.
         *
         * @throws IndexOutOfBoundsException when either endpoint is out of range.
         * @throws InvalidWeightException when {@code weight} is negative.
         */
        public Builder addEdge(int source, int destination, int weight) {
            ensureOpen();
            checkNode(source);
            checkNode(destination);
            checkWeight(source, destination, weight);
            link(source, destination, weight);
            return this;
        }

        /**
         * Adds {@code u -> v} and {@code v -> u} with {@link #DEFAULT_WEIGHT}.
         */
        public Builder addUndirectedEdge(int u, int v) {
            return addUndirectedEdge(u, v, DEFAULT_WEIGHT);
        }

        /**
         * Adds both directions atomically: nothing is linked unless both endpoints and the weight are valid.
         */
        public Builder addUndirectedEdge(int u, int v, int weight) {
            ensureOpen();
            checkNode(u);
            checkNode(v);
            checkWeight(u, v, weight);
            link(u, v, weight);
            link(v, u, weight);
            return this;
        }

        /**
         * Assigns the display name of a node. Each node can be named once.
         */
        public Builder name(int nodeId, String name) {
            ensureOpen();
            checkNode(nodeId);
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must be non-blank for node " + nodeId);
            }
            if (nodeNames[nodeId] != null) {
                throw new IllegalStateException("Node " + nodeId + " already named " + nodeNames[nodeId]);
            }
            nodeNames[nodeId] = name;
            return this;
        }

        public AdjacencyGraph build() {
            ensureOpen();
            built = true;
            try {
                return new AdjacencyGraph(this);
            } catch (OutOfMemoryError error) {
                throw new GraphAllocationException("cannot allocate edge storage for " + edgeTarget.size() + " edges", error);
            }
        }

        private void link(int source, int destination, int weight) {
            int edgeId = edgeTarget.size();
            edgeSource.add(source);
            edgeTarget.add(destination);
            edgeWeight.add(weight);
            edgeNext.add(head[source]);
            head[source] = edgeId;
            outDegree[source]++;
        }

        private void checkNode(int nodeId) {
            if (nodeId < 0 || nodeId >= nodeCount) {
                throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
            }
        }

        private static void checkWeight(int source, int destination, int weight) {
            if (weight < 0) {
                throw new InvalidWeightException(
                        "Negative weight " + weight + " on edge " + source + "->" + destination
                );
            }
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("Graph already built; edges can only be added during construction");
            }
        }
    }
}
