package org.Aayush.wayfinder.routing.graph;

/**
 * Construction-time bounds for graph storage.
 */
public final class GraphLimits {
    public static final int DEFAULT_MAX_NODES = 1 << 24;

    static final String PROP_MAX_NODES = "wayfinder.graph.maxNodes";

    private final int maxNodes;

    private GraphLimits(int maxNodes) {
        this.maxNodes = maxNodes <= 0 ? DEFAULT_MAX_NODES : maxNodes;
    }

    /**
     * Creates limits with an explicit node ceiling. Non-positive values select the default.
     */
    public static GraphLimits of(int maxNodes) {
        return new GraphLimits(maxNodes);
    }

    /**
     * Loads limits from system properties, falling back to defaults on blank or bad values.
     */
    public static GraphLimits defaults() {
        return new GraphLimits(readBound(PROP_MAX_NODES));
    }

    public int maxNodes() {
        return maxNodes;
    }

    /**
     * Rejects node counts above the ceiling.
     *
     * @throws GraphAllocationException when {@code nodeCount} exceeds {@link #maxNodes()}.
     */
    void checkNodeCount(int nodeCount) {
        if (nodeCount > maxNodes) {
            throw new GraphAllocationException(
                    "node count " + nodeCount + " exceeds limit " + maxNodes + " (" + PROP_MAX_NODES + ")"
            );
        }
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_NODES;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_NODES;
        }
    }
}
