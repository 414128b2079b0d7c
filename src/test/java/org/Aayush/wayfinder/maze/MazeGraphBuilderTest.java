package org.Aayush.wayfinder.maze;

import org.Aayush.wayfinder.routing.core.RouteRequest;
import org.Aayush.wayfinder.routing.core.RouteResponse;
import org.Aayush.wayfinder.routing.core.RoutingAlgorithm;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;
import org.Aayush.wayfinder.routing.graph.GraphAllocationException;
import org.Aayush.wayfinder.routing.graph.GraphLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazeGraphBuilder")
class MazeGraphBuilderTest {

    private static RouteResponse solve(MazeGraph maze, RoutingAlgorithm algorithm) {
        return maze.router().route(RouteRequest.builder()
                .sourceExternalId(maze.mapper().toExternal(maze.startNode()))
                .targetExternalId(maze.mapper().toExternal(maze.endNode()))
                .algorithm(algorithm)
                .build());
    }

    @Test
    @DisplayName("One node per cell, walls isolated, open neighbours linked both ways")
    void testStructure() {
        MazeGraph maze = MazeGraphBuilder.build(MazeGrid.parse(List.of("S.#", "#.E")));
        AdjacencyGraph graph = maze.graph();

        assertEquals(6, graph.nodeCount());
        assertEquals(0, maze.startNode());
        assertEquals(5, maze.endNode());
        assertEquals(0, graph.outDegree(2));
        assertEquals(0, graph.outDegree(3));
        assertTrue(graph.hasEdge(0, 1));
        assertTrue(graph.hasEdge(1, 0));
        assertTrue(graph.hasEdge(1, 4));
        assertTrue(graph.hasEdge(4, 5));
        assertFalse(graph.hasEdge(0, 4), "no diagonal moves");
    }

    @Test
    @DisplayName("Each adjacency is inserted from both cells")
    void testDuplicateAdjacency() {
        MazeGraph maze = MazeGraphBuilder.build(MazeGrid.parse(List.of("SE")));

        // 0 links 0<->1, then 1 links 1<->0
        assertEquals(4, maze.graph().edgeCount());
        assertEquals(2, maze.graph().outDegree(0));
    }

    @Test
    @DisplayName("Reference maze: BFS finds the 13-step shortest path")
    void testDefaultMazeBfs() {
        MazeGraph maze = MazeGraphBuilder.build(MazeLoader.loadDefault());

        RouteResponse response = solve(maze, RoutingAlgorithm.BFS);

        assertTrue(response.isReachable());
        assertEquals(13, response.getHopCount());
        assertEquals(List.of(
                "(1, 1)", "(2, 1)", "(3, 1)", "(4, 1)", "(4, 2)", "(4, 3)", "(4, 4)",
                "(4, 5)", "(4, 6)", "(3, 6)", "(3, 7)", "(3, 8)", "(2, 8)", "(1, 8)"
        ), response.getPathExternalNodeIds());
    }

    @Test
    @DisplayName("Reference maze: DFS takes the lower detour")
    void testDefaultMazeDfs() {
        MazeGraph maze = MazeGraphBuilder.build(MazeLoader.loadDefault());

        RouteResponse response = solve(maze, RoutingAlgorithm.DFS);

        assertTrue(response.isReachable());
        assertEquals(17, response.getHopCount());
        assertEquals(List.of(
                "(1, 1)", "(2, 1)", "(3, 1)", "(4, 1)", "(4, 2)", "(4, 3)", "(4, 4)",
                "(4, 5)", "(4, 6)", "(5, 6)", "(6, 6)", "(6, 7)", "(6, 8)", "(5, 8)",
                "(4, 8)", "(3, 8)", "(2, 8)", "(1, 8)"
        ), response.getPathExternalNodeIds());
    }

    @Test
    @DisplayName("Walled-off end is reported unreachable")
    void testWalledOff() {
        MazeGraph maze = MazeGraphBuilder.build(MazeLoader.loadResource("mazes/walled.txt"));

        assertFalse(solve(maze, RoutingAlgorithm.BFS).isReachable());
        assertFalse(solve(maze, RoutingAlgorithm.DFS).isReachable());
    }

    @Test
    @DisplayName("Grids over the node limit fail allocation")
    void testLimit() {
        MazeGrid grid = MazeGrid.parse(List.of("S...", "...E"));

        assertThrows(GraphAllocationException.class, () -> MazeGraphBuilder.build(grid, GraphLimits.of(7)));
        assertEquals(8, MazeGraphBuilder.build(grid, GraphLimits.of(8)).graph().nodeCount());
    }
}
