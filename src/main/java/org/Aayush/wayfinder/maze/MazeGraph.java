package org.Aayush.wayfinder.maze;

import org.Aayush.wayfinder.core.id.GridIDMapper;
import org.Aayush.wayfinder.routing.core.RouteCore;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;

/**
 * A maze together with its cell graph.
 *
 * @param grid parsed maze.
 * @param graph one node per cell; walls are isolated nodes.
 * @param mapper cell/index conversion for this grid.
 * @param startNode node of the {@code S} cell.
 * @param endNode node of the {@code E} cell.
 */
public record MazeGraph(
        MazeGrid grid,
        AdjacencyGraph graph,
        GridIDMapper mapper,
        int startNode,
        int endNode
) {
    /**
     * Route facade over this maze, addressed by {@code "(row, col)"} ids.
     */
    public RouteCore router() {
        return RouteCore.builder()
                .graph(graph)
                .nodeIdMapper(mapper)
                .build();
    }
}
