package org.Aayush.wayfinder.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Level-order search returning a minimum-edge-count path.
 * <p>
 * Stops on the first dequeue of the target. Among equally short paths the one found first in
 * adjacency order wins, so results are deterministic for a given construction order.
 */
public final class BreadthFirstSearch implements UnweightedSearch {

    @Override
    public SearchOutcome search(AdjacencyGraph graph, int start, int end) {
        Objects.requireNonNull(graph, "graph");
        graph.checkNode(start);
        graph.checkNode(end);

        int[] predecessors = new int[graph.nodeCount()];
        Arrays.fill(predecessors, SearchOutcome.NO_PREDECESSOR);
        VisitedSet visited = new VisitedSet(graph.nodeCount());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        AdjacencyGraph.NeighborIterator iterator = graph.iterator();

        visited.markVisited(start);
        queue.enqueue(start);

        while (!queue.isEmpty()) {
            int u = queue.dequeueInt();
            if (u == end) {
                return new SearchOutcome(true, start, end, predecessors, visited.count());
            }
            iterator.resetForNode(u);
            while (iterator.hasNext()) {
                int v = iterator.nextDestination();
                if (visited.markVisited(v)) {
                    predecessors[v] = u;
                    queue.enqueue(v);
                }
            }
        }
        return new SearchOutcome(false, start, end, predecessors, visited.count());
    }
}
