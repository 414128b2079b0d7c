package org.Aayush.wayfinder.routing.core;

import lombok.Builder;
import org.Aayush.wayfinder.core.id.IDMapper;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;
import org.Aayush.wayfinder.routing.path.NodePath;
import org.Aayush.wayfinder.routing.path.PathReconstructor;
import org.Aayush.wayfinder.routing.path.PredecessorCycleException;
import org.Aayush.wayfinder.routing.search.BreadthFirstSearch;
import org.Aayush.wayfinder.routing.search.DepthFirstSearch;
import org.Aayush.wayfinder.routing.search.DijkstraSearch;
import org.Aayush.wayfinder.routing.search.DijkstraTieBreak;
import org.Aayush.wayfinder.routing.search.SearchOutcome;
import org.Aayush.wayfinder.routing.search.ShortestPathTree;
import org.Aayush.wayfinder.routing.search.UnweightedSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Main routing orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Normalize client payloads from external node ids to internal node ids.</li>
 * <li>Validate required fields.</li>
 * <li>Delegate to BFS, DFS or Dijkstra and reconstruct the node path.</li>
 * <li>Wrap contract failures into {@link RouteCoreException} with stable reason codes.</li>
 * <li>Map internal node paths back to external ids.</li>
 * </ul>
 *
 * <p>The graph is read-only and every search allocates its own working state, so one instance
 * can serve concurrent callers.</p>
 */
public final class RouteCore implements RouterService {
    public static final String REASON_ROUTE_REQUEST_REQUIRED = "WF_ROUTE_REQUEST_REQUIRED";
    public static final String REASON_SOURCE_EXTERNAL_ID_REQUIRED = "WF_SOURCE_EXTERNAL_ID_REQUIRED";
    public static final String REASON_TARGET_EXTERNAL_ID_REQUIRED = "WF_TARGET_EXTERNAL_ID_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "WF_ALGORITHM_REQUIRED";
    public static final String REASON_UNKNOWN_EXTERNAL_NODE = "WF_UNKNOWN_EXTERNAL_NODE";
    public static final String REASON_INTERNAL_NODE_OUT_OF_BOUNDS = "WF_INTERNAL_NODE_OUT_OF_BOUNDS";
    public static final String REASON_PATH_RECONSTRUCTION_FAILED = "WF_PATH_RECONSTRUCTION_FAILED";
    public static final String REASON_EXTERNAL_MAPPING_FAILED = "WF_EXTERNAL_MAPPING_FAILED";

    private static final Logger log = LoggerFactory.getLogger(RouteCore.class);

    private final AdjacencyGraph graph;
    private final IDMapper nodeIdMapper;
    private final UnweightedSearch breadthFirst;
    private final UnweightedSearch depthFirst;
    private final DijkstraSearch dijkstra;

    /**
     * Creates the route-core facade.
     *
     * @param graph immutable graph to search.
     * @param nodeIdMapper external-to-internal node id mapper covering every graph node.
     * @param tieBreak Dijkstra tie-break policy; {@code null} selects {@link DijkstraTieBreak#defaults()}.
     */
    @Builder
    public RouteCore(AdjacencyGraph graph, IDMapper nodeIdMapper, DijkstraTieBreak tieBreak) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.nodeIdMapper = Objects.requireNonNull(nodeIdMapper, "nodeIdMapper");
        if (nodeIdMapper.size() != graph.nodeCount()) {
            throw new IllegalArgumentException(
                    "nodeIdMapper size " + nodeIdMapper.size() + " does not match graph node count " + graph.nodeCount()
            );
        }
        this.breadthFirst = new BreadthFirstSearch();
        this.depthFirst = new DepthFirstSearch();
        this.dijkstra = new DijkstraSearch(tieBreak == null ? DijkstraTieBreak.defaults() : tieBreak);
    }

    /**
     * Executes one client point-to-point request.
     *
     * @param request route request in external-id space.
     * @return response containing reachability, path and cost.
     * @throws RouteCoreException when request contracts fail.
     */
    @Override
    public RouteResponse route(RouteRequest request) {
        if (request == null) {
            throw new RouteCoreException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        RoutingAlgorithm algorithm = requireAlgorithm(request.getAlgorithm());
        int source = toInternalNodeId(request.getSourceExternalId(), REASON_SOURCE_EXTERNAL_ID_REQUIRED, "sourceExternalId");
        int target = toInternalNodeId(request.getTargetExternalId(), REASON_TARGET_EXTERNAL_ID_REQUIRED, "targetExternalId");

        RouteResponse response = switch (algorithm) {
            case BFS -> routeUnweighted(breadthFirst, algorithm, source, target);
            case DFS -> routeUnweighted(depthFirst, algorithm, source, target);
            case DIJKSTRA -> routeWeighted(source, target);
        };
        log.debug("route {} {} -> {}: reachable={}, hops={}, cost={}",
                algorithm, request.getSourceExternalId(), request.getTargetExternalId(),
                response.isReachable(), response.getHopCount(), response.getTotalCost());
        return response;
    }

    /**
     * Runs Dijkstra from one external source and returns the full tree in internal ids.
     *
     * @throws RouteCoreException when the source id is missing or unknown.
     */
    public ShortestPathTree shortestPathTree(String sourceExternalId) {
        int source = toInternalNodeId(sourceExternalId, REASON_SOURCE_EXTERNAL_ID_REQUIRED, "sourceExternalId");
        return dijkstra.shortestPathTree(graph, source);
    }

    public AdjacencyGraph graph() {
        return graph;
    }

    private RouteResponse routeUnweighted(UnweightedSearch search, RoutingAlgorithm algorithm, int source, int target) {
        SearchOutcome outcome = search.search(graph, source, target);
        NodePath path = reconstruct(() -> PathReconstructor.reconstruct(outcome));
        return toResponse(algorithm, path, path.hopCount(), outcome.visitedCount());
    }

    private RouteResponse routeWeighted(int source, int target) {
        ShortestPathTree tree = dijkstra.shortestPathTree(graph, source);
        NodePath path = reconstruct(() -> PathReconstructor.reconstruct(tree, target));
        return toResponse(RoutingAlgorithm.DIJKSTRA, path, tree.distanceTo(target), tree.settledCount());
    }

    private RouteResponse toResponse(RoutingAlgorithm algorithm, NodePath path, long cost, int explored) {
        RouteResponse.RouteResponseBuilder builder = RouteResponse.builder()
                .reachable(!path.isEmpty())
                .totalCost(path.isEmpty() ? RouteResponse.UNREACHABLE_COST : cost)
                .hopCount(path.hopCount())
                .exploredNodes(explored)
                .algorithm(algorithm);
        for (String node : toExternalNodePath(path)) {
            builder.pathNode(node);
        }
        return builder.build();
    }

    /**
     * Converts reconstruction defects into reason-coded failures.
     */
    private NodePath reconstruct(Supplier<NodePath> reconstruction) {
        try {
            return reconstruction.get();
        } catch (PredecessorCycleException | IndexOutOfBoundsException ex) {
            throw new RouteCoreException(REASON_PATH_RECONSTRUCTION_FAILED, ex.getMessage(), ex);
        }
    }

    /**
     * Resolves one external node id to an internal node id with bounds validation.
     */
    private int toInternalNodeId(String externalId, String requiredReasonCode, String fieldName) {
        if (externalId == null || externalId.isBlank()) {
            throw new RouteCoreException(requiredReasonCode, fieldName + " must be non-blank");
        }
        final int internalNodeId;
        try {
            internalNodeId = nodeIdMapper.toInternal(externalId);
        } catch (IDMapper.UnknownIDException ex) {
            throw new RouteCoreException(
                    REASON_UNKNOWN_EXTERNAL_NODE,
                    "unknown external node id: " + externalId,
                    ex
            );
        }
        if (internalNodeId < 0 || internalNodeId >= graph.nodeCount()) {
            throw new RouteCoreException(
                    REASON_INTERNAL_NODE_OUT_OF_BOUNDS,
                    "mapped internal node id out of range for " + externalId + ": " + internalNodeId
            );
        }
        return internalNodeId;
    }

    /**
     * Maps an internal node path to an immutable external-id path.
     */
    private List<String> toExternalNodePath(NodePath path) {
        List<String> externalPath = new ArrayList<>(path.size());
        for (int i = 0; i < path.size(); i++) {
            int nodeId = path.nodeAt(i);
            try {
                externalPath.add(nodeIdMapper.toExternal(nodeId));
            } catch (RuntimeException ex) {
                throw new RouteCoreException(
                        REASON_EXTERNAL_MAPPING_FAILED,
                        "failed to map internal node " + nodeId + " to external id",
                        ex
                );
            }
        }
        return List.copyOf(externalPath);
    }

    private RoutingAlgorithm requireAlgorithm(RoutingAlgorithm algorithm) {
        if (algorithm == null) {
            throw new RouteCoreException(REASON_ALGORITHM_REQUIRED, "algorithm must be specified");
        }
        return algorithm;
    }
}
