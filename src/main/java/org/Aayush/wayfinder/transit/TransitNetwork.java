package org.Aayush.wayfinder.transit;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wayfinder.core.id.IDMapper;
import org.Aayush.wayfinder.routing.core.RouteCore;
import org.Aayush.wayfinder.routing.graph.AdjacencyGraph;
import org.Aayush.wayfinder.routing.graph.GraphLimits;
import org.Aayush.wayfinder.routing.search.DijkstraTieBreak;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Named stations joined by directed, timed connections.
 * <p>
 * Connections are stored exactly as declared: {@code A -> B} says nothing about {@code B -> A},
 * and the two directions may take different times.
 */
public final class TransitNetwork {

    private final List<String> stationNames;
    private final IDMapper stationIds;
    private final AdjacencyGraph graph;

    private TransitNetwork(List<String> stationNames, IDMapper stationIds, AdjacencyGraph graph) {
        this.stationNames = stationNames;
        this.stationIds = stationIds;
        this.graph = graph;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int stationCount() {
        return stationNames.size();
    }

    /**
     * Station names in index order.
     */
    public List<String> stationNames() {
        return stationNames;
    }

    public String stationName(int stationIndex) {
        return graph.nodeName(stationIndex);
    }

    public AdjacencyGraph graph() {
        return graph;
    }

    /**
     * Resolves a station given either its index ({@code "3"}) or its exact name.
     *
     * @throws IDMapper.UnknownIDException when the token matches neither.
     */
    public int resolveStation(String token) {
        if (token == null || token.isBlank()) {
            throw new IDMapper.UnknownIDException("Station must be non-blank");
        }
        String trimmed = token.trim();
        if (stationIds.containsExternal(trimmed)) {
            return stationIds.toInternal(trimmed);
        }
        if (isIndex(trimmed)) {
            int index = Integer.parseInt(trimmed);
            if (stationIds.containsInternal(index)) {
                return index;
            }
        }
        throw new IDMapper.UnknownIDException("Unknown station: " + token);
    }

    private static boolean isIndex(String token) {
        return token.length() <= 9 && token.chars().allMatch(Character::isDigit);
    }

    /**
     * Route facade addressed by station name.
     */
    public RouteCore router(DijkstraTieBreak tieBreak) {
        return RouteCore.builder()
                .graph(graph)
                .nodeIdMapper(stationIds)
                .tieBreak(tieBreak)
                .build();
    }

    public RouteCore router() {
        return router(null);
    }

    /**
     * Collects stations and connections; stations must be declared before connections use them.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final IntArrayList sources = new IntArrayList();
        private final IntArrayList targets = new IntArrayList();
        private final IntArrayList minutes = new IntArrayList();
        private GraphLimits limits = GraphLimits.defaults();

        private Builder() {
        }

        public Builder limits(GraphLimits limits) {
            this.limits = Objects.requireNonNull(limits, "limits");
            return this;
        }

        /**
         * Declares the next station; its index is the number of stations declared before it.
         */
        public Builder station(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("station name must be non-blank");
            }
            if (names.contains(name)) {
                throw new IllegalArgumentException("duplicate station: " + name);
            }
            names.add(name);
            return this;
        }

        public Builder stations(String... stationNames) {
            for (String name : stationNames) {
                station(name);
            }
            return this;
        }

        /**
         * Adds a directed connection between declared stations, by name.
         */
        public Builder connection(String from, String to, int travelMinutes) {
            return connection(indexOf(from), indexOf(to), travelMinutes);
        }

        /**
         * Adds a directed connection between declared stations, by index.
         * Range and weight checks happen in {@link #build()}, through the graph builder.
         */
        public Builder connection(int from, int to, int travelMinutes) {
            sources.add(from);
            targets.add(to);
            minutes.add(travelMinutes);
            return this;
        }

        /**
         * @throws IndexOutOfBoundsException when a connection refers to an undeclared index.
         * @throws org.Aayush.wayfinder.routing.graph.InvalidWeightException when a travel time is negative.
         */
        public TransitNetwork build() {
            AdjacencyGraph.Builder graph = AdjacencyGraph.builder(names.size(), limits);
            for (int i = 0; i < names.size(); i++) {
                graph.name(i, names.get(i));
            }
            for (int i = 0; i < sources.size(); i++) {
                graph.addEdge(sources.getInt(i), targets.getInt(i), minutes.getInt(i));
            }
            List<String> frozen = List.copyOf(names);
            return new TransitNetwork(frozen, IDMapper.ofNames(frozen), graph.build());
        }

        private int indexOf(String name) {
            int index = names.indexOf(name);
            if (index < 0) {
                throw new IDMapper.UnknownIDException("Unknown station: " + name);
            }
            return index;
        }
    }
}
