package org.Aayush.wayfinder.routing.search;

/**
 * Result of one unweighted search.
 *
 * @param found whether the target was reached.
 * @param start source node of the search.
 * @param end target node of the search.
 * @param predecessors per-node predecessor, {@link #NO_PREDECESSOR} when unreached or the source.
 * @param visitedCount number of nodes marked visited before the search stopped.
 */
public record SearchOutcome(
        boolean found,
        int start,
        int end,
        int[] predecessors,
        int visitedCount
) {
    /** Predecessor sentinel for the source and for unreached nodes. */
    public static final int NO_PREDECESSOR = -1;
}
