package org.Aayush.wayfinder.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Client-facing point-to-point route response.
 *
 * <p>When {@code reachable=false}, {@code pathExternalNodeIds} is empty and {@code totalCost}
 * is {@link #UNREACHABLE_COST}. For BFS and DFS every edge counts as one, so {@code totalCost}
 * equals {@code hopCount}; for DIJKSTRA it is the summed edge weight.</p>
 */
@Value
@Builder
public class RouteResponse {
    public static final long UNREACHABLE_COST = -1L;

    /** Whether a path was found from source to target. */
    boolean reachable;
    /** Total route cost. */
    long totalCost;
    /** Number of edges on the returned path. */
    int hopCount;
    /** Nodes visited or settled by the search. */
    int exploredNodes;
    /** Search algorithm that produced this response. */
    RoutingAlgorithm algorithm;
    /** Path expressed in external node ids from source to target. */
    @Singular("pathNode")
    List<String> pathExternalNodeIds;
}
