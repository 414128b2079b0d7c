package org.Aayush.wayfinder.routing.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.wayfinder.routing.search.SearchOutcome;
import org.Aayush.wayfinder.routing.search.ShortestPathTree;

import java.util.Objects;

/**
 * Turns predecessor arrays into start-to-end node paths.
 */
@UtilityClass
public class PathReconstructor {

    /**
     * Walks predecessors backward from {@code end} and returns the path read from {@code start}.
     * <ul>
     * <li>{@code start == end}: the single-node path.</li>
     * <li>{@code end} has no predecessor, or the chain ends before reaching {@code start}:
     * {@link NodePath#empty()}.</li>
     * </ul>
     *
     * @param predecessors per-node predecessor with {@link SearchOutcome#NO_PREDECESSOR} sentinels.
     * @throws IndexOutOfBoundsException when an endpoint or a stored predecessor is out of range.
     * @throws PredecessorCycleException when the chain exceeds {@code predecessors.length} steps.
     */
    public NodePath reconstruct(int[] predecessors, int start, int end) {
        Objects.requireNonNull(predecessors, "predecessors");
        int nodeCount = predecessors.length;
        checkNode(start, nodeCount);
        checkNode(end, nodeCount);

        if (start == end) {
            return NodePath.of(start);
        }
        if (predecessors[end] == SearchOutcome.NO_PREDECESSOR) {
            return NodePath.empty();
        }

        IntArrayList reversed = new IntArrayList();
        int current = end;
        int steps = 0;
        while (current != start) {
            if (current == SearchOutcome.NO_PREDECESSOR) {
                return NodePath.empty();
            }
            if (++steps > nodeCount) {
                throw new PredecessorCycleException(
                        "predecessor chain from " + end + " exceeds " + nodeCount + " steps without reaching " + start
                );
            }
            checkNode(current, nodeCount);
            reversed.add(current);
            current = predecessors[current];
        }
        reversed.add(start);

        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return NodePath.of(path);
    }

    /**
     * Path for a finished unweighted search; empty when the target was not found.
     */
    public NodePath reconstruct(SearchOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (!outcome.found()) {
            return NodePath.empty();
        }
        return reconstruct(outcome.predecessors(), outcome.start(), outcome.end());
    }

    /**
     * Cheapest path from the tree's source to {@code end}; empty when {@code end} is unreachable.
     */
    public NodePath reconstruct(ShortestPathTree tree, int end) {
        Objects.requireNonNull(tree, "tree");
        if (!tree.isReachable(end)) {
            return NodePath.empty();
        }
        return reconstruct(tree.predecessors(), tree.start(), end);
    }

    private void checkNode(int nodeId, int nodeCount) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
    }
}
