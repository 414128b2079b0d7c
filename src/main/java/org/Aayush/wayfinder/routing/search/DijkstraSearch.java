package org.Aayush.wayfinder.routing.search;

import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Single-source shortest paths over non-negative integer weights.
 * <p>
 * Linear-scan selection, O(N^2 + E). Suited to small networks such as transit maps; no
 * priority queue is involved, so the settle order is fully described by {@link DijkstraTieBreak}.
 * Negative weights cannot occur: {@link AdjacencyGraph.Builder} rejects them.
 * <p>
 * Stateless apart from the tie-break policy; one instance may serve concurrent calls.
 */
public final class DijkstraSearch {

    private final DijkstraTieBreak tieBreak;

    public DijkstraSearch() {
        this(DijkstraTieBreak.defaults());
    }

    public DijkstraSearch(DijkstraTieBreak tieBreak) {
        this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak");
    }

    public DijkstraTieBreak tieBreak() {
        return tieBreak;
    }

    /**
     * Computes distances and predecessors from {@code start} to every node.
     *
     * @throws IndexOutOfBoundsException when {@code start} is out of range.
     */
    public ShortestPathTree shortestPathTree(AdjacencyGraph graph, int start) {
        Objects.requireNonNull(graph, "graph");
        graph.checkNode(start);

        int nodeCount = graph.nodeCount();
        long[] distances = new long[nodeCount];
        int[] predecessors = new int[nodeCount];
        Arrays.fill(distances, ShortestPathTree.UNREACHABLE);
        Arrays.fill(predecessors, SearchOutcome.NO_PREDECESSOR);
        VisitedSet settled = new VisitedSet(nodeCount);
        AdjacencyGraph.NeighborIterator iterator = graph.iterator();

        distances[start] = 0L;
        int settledCount = 0;

        while (settledCount < nodeCount) {
            int u = selectMinimum(distances, settled);
            if (u < 0) {
                break;
            }
            settled.markVisited(u);
            settledCount++;

            long base = distances[u];
            iterator.resetForNode(u);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                int v = graph.edgeDestination(edgeId);
                if (settled.isVisited(v)) {
                    continue;
                }
                long candidate = base + graph.edgeWeight(edgeId);
                if (candidate < distances[v]) {
                    distances[v] = candidate;
                    predecessors[v] = u;
                }
            }
        }
        return new ShortestPathTree(start, distances, predecessors, settledCount);
    }

    /**
     * Unsettled node with minimum finite distance under the tie-break policy, or -1 when none remains.
     */
    private int selectMinimum(long[] distances, VisitedSet settled) {
        int best = -1;
        long bestDistance = ShortestPathTree.UNREACHABLE;
        for (int v = 0; v < distances.length; v++) {
            long d = distances[v];
            if (d == ShortestPathTree.UNREACHABLE || settled.isVisited(v)) {
                continue;
            }
            if (best < 0 || tieBreak.prefers(d, bestDistance)) {
                best = v;
                bestDistance = d;
            }
        }
        return best;
    }
}
