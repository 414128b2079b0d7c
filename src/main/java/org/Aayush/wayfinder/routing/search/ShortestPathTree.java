package org.Aayush.wayfinder.routing.search;

/**
 * Single-source Dijkstra output covering every node.
 *
 * @param start source node.
 * @param distances minimum accumulated weight per node, {@link #UNREACHABLE} when not reachable.
 * @param predecessors per-node predecessor on a cheapest path, {@link SearchOutcome#NO_PREDECESSOR}
 *                     for the source and for unreachable nodes.
 * @param settledCount number of nodes settled before the search stopped.
 */
public record ShortestPathTree(
        int start,
        long[] distances,
        int[] predecessors,
        int settledCount
) {
    /** Distance sentinel for nodes not reachable from the source. */
    public static final long UNREACHABLE = Long.MAX_VALUE;

    public boolean isReachable(int nodeId) {
        checkNode(nodeId);
        return distances[nodeId] != UNREACHABLE;
    }

    public long distanceTo(int nodeId) {
        checkNode(nodeId);
        return distances[nodeId];
    }

    public int predecessorOf(int nodeId) {
        checkNode(nodeId);
        return predecessors[nodeId];
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= distances.length) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
    }
}
