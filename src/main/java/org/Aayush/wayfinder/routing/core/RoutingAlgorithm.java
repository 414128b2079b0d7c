package org.Aayush.wayfinder.routing.core;

/**
 * Search strategy selector used by route-core execution.
 */
public enum RoutingAlgorithm {
    /** Breadth-first: fewest edges, weights ignored. */
    BFS,
    /** Depth-first: some path, weights ignored. */
    DFS,
    /** Dijkstra: minimum total weight. */
    DIJKSTRA
}
