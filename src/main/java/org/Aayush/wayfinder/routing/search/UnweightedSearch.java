package org.Aayush.wayfinder.routing.search;

import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;

/**
 * Point-to-point search that ignores edge weights.
 */
public interface UnweightedSearch {
    /**
     * Searches from {@code start} towards {@code end}.
     *
     * @param graph graph to traverse.
     * @param start source node id.
     * @param end target node id.
     * @return outcome with a fresh predecessor array; {@code found=false} is a normal result.
     * @throws IndexOutOfBoundsException when either node id is out of range.
     */
    SearchOutcome search(AdjacencyGraph graph, int start, int end);
}
