package org.Aayush.wayfinder.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Depth-first reachability search returning <em>a</em> path, not necessarily the shortest.
 * <p>
 * Iterative with an explicit frame stack, visiting nodes in the same order as the recursive
 * form: a node is marked on entry, neighbours are tried in adjacency order, and the search
 * stops the moment the target is entered.
 */
public final class DepthFirstSearch implements UnweightedSearch {

    @Override
    public SearchOutcome search(AdjacencyGraph graph, int start, int end) {
        Objects.requireNonNull(graph, "graph");
        graph.checkNode(start);
        graph.checkNode(end);

        int[] predecessors = new int[graph.nodeCount()];
        Arrays.fill(predecessors, SearchOutcome.NO_PREDECESSOR);
        VisitedSet visited = new VisitedSet(graph.nodeCount());

        visited.markVisited(start);
        if (start == end) {
            return new SearchOutcome(true, start, end, predecessors, visited.count());
        }

        // Frame = (node, cursor into that node's edge chain).
        IntArrayList frameNodes = new IntArrayList();
        IntArrayList frameCursors = new IntArrayList();
        frameNodes.add(start);
        frameCursors.add(graph.firstEdge(start));

        while (!frameNodes.isEmpty()) {
            int top = frameNodes.size() - 1;
            int u = frameNodes.getInt(top);
            int edgeId = frameCursors.getInt(top);

            int next = SearchOutcome.NO_PREDECESSOR;
            while (edgeId != AdjacencyGraph.NO_EDGE) {
                int v = graph.edgeDestination(edgeId);
                edgeId = graph.nextEdge(edgeId);
                if (!visited.isVisited(v)) {
                    next = v;
                    break;
                }
            }

            if (next == SearchOutcome.NO_PREDECESSOR) {
                frameNodes.removeInt(top);
                frameCursors.removeInt(top);
                continue;
            }

            frameCursors.set(top, edgeId);
            predecessors[next] = u;
            visited.markVisited(next);
            if (next == end) {
                return new SearchOutcome(true, start, end, predecessors, visited.count());
            }
            frameNodes.add(next);
            frameCursors.add(graph.firstEdge(next));
        }
        return new SearchOutcome(false, start, end, predecessors, visited.count());
    }
}
