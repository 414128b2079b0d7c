package org.Aayush.wayfinder.maze;

import lombok.experimental.UtilityClass;
import org.Aayush.wayfinder.core.id.GridIDMapper;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;
import org.Aayush.wayfinder.routing.graph.GraphLimits;

import java.util.Objects;

/**
 * Converts a maze into an undirected unit-weight graph over its cells.
 * <p>
 * Cells are scanned in row-major order and each open neighbour is linked in the order
 * up, down, left, right. Both cells of an adjacent pair link each other, so every adjacency
 * appears twice per direction; duplicates only cost space. The scan order fixes the
 * neighbour order searches see.
 */
@UtilityClass
public class MazeGraphBuilder {

    private static final int[] ROW_OFFSETS = {-1, 1, 0, 0};
    private static final int[] COLUMN_OFFSETS = {0, 0, -1, 1};

    public MazeGraph build(MazeGrid grid) {
        return build(grid, GraphLimits.defaults());
    }

    /**
     * @throws org.Aayush.wayfinder.routing.graph.GraphAllocationException when the grid exceeds {@code limits}.
     */
    public MazeGraph build(MazeGrid grid, GraphLimits limits) {
        Objects.requireNonNull(grid, "grid");
        GridIDMapper mapper = new GridIDMapper(grid.rows(), grid.columns());
        AdjacencyGraph.Builder builder = AdjacencyGraph.builder(mapper.size(), limits);

        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.columns(); c++) {
                if (!grid.isOpen(r, c)) {
                    continue;
                }
                int u = mapper.toIndex(r, c);
                for (int d = 0; d < ROW_OFFSETS.length; d++) {
                    int nr = r + ROW_OFFSETS[d];
                    int nc = c + COLUMN_OFFSETS[d];
                    if (grid.isOpen(nr, nc)) {
                        builder.addUndirectedEdge(u, mapper.toIndex(nr, nc));
                    }
                }
            }
        }

        return new MazeGraph(
                grid,
                builder.build(),
                mapper,
                mapper.toIndex(grid.start().row(), grid.start().column()),
                mapper.toIndex(grid.end().row(), grid.end().column())
        );
    }
}
