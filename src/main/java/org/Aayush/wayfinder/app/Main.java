package org.Aayush.wayfinder.app;

import org.Aayush.wayfinder.core.id.IDMapper;
import org.Aayush.wayfinder.maze.MalformedMazeException;
import org.Aayush.wayfinder.maze.MazeGraph;
import org.Aayush.wayfinder.maze.MazeGraphBuilder;
import org.Aayush.wayfinder.maze.MazeGrid;
import org.Aayush.wayfinder.maze.MazeLoader;
import org.Aayush.wayfinder.maze.MissingEndpointException;
import org.Aayush.wayfinder.routing.core.RouteCore;
import org.Aayush.wayfinder.routing.core.RouteCoreException;
import org.Aayush.wayfinder.routing.core.RouteRequest;
import org.Aayush.wayfinder.routing.core.RouteResponse;
import org.Aayush.wayfinder.routing.core.RoutingAlgorithm;
import org.Aayush.wayfinder.routing.graph.GraphAllocationException;
import org.Aayush.wayfinder.transit.TransitNetwork;
import org.Aayush.wayfinder.transit.TransitNetworks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 *   maze [file]          BFS and DFS over a maze (bundled maze when no file is given)
 *   transit FROM TO      fastest route between stations, by name or index
 *   stations             list the bundled stations
 * </pre>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FATAL = 2;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * Launches the CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one command, writing results to {@code out} and diagnostics to {@code err}.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String command = args.length == 0 ? "maze" : args[0];
        try {
            switch (command) {
                case "maze":
                    return runMaze(args.length > 1 ? args[1] : null, out);
                case "transit":
                    if (args.length != 3) {
                        err.println("Usage: transit FROM TO");
                        return EXIT_USAGE;
                    }
                    return runTransit(TransitNetworks.reference(), args[1], args[2], out, err);
                case "stations":
                    printStations(TransitNetworks.reference(), out);
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    err.println("Commands: maze [file] | transit FROM TO | stations");
                    return EXIT_USAGE;
            }
        } catch (MissingEndpointException | MalformedMazeException ex) {
            log.warn("Rejected maze input: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (IOException ex) {
            log.warn("Could not read maze", ex);
            err.println("Error: cannot read maze: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (RouteCoreException ex) {
            log.warn("Route request rejected: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (GraphAllocationException ex) {
            log.error("Graph allocation failed", ex);
            err.println("Fatal: " + ex.getMessage());
            return EXIT_FATAL;
        }
    }

    private static int runMaze(String file, PrintStream out) throws IOException {
        MazeGrid grid = file == null ? MazeLoader.loadDefault() : MazeLoader.load(Path.of(file));
        MazeGraph maze = MazeGraphBuilder.build(grid);
        RouteCore router = maze.router();
        String start = maze.mapper().toExternal(maze.startNode());
        String end = maze.mapper().toExternal(maze.endNode());

        out.println("Maze:");
        out.print(grid.render());

        out.println();
        out.println("--- Breadth-first search (BFS) ---");
        printMazePath(router.route(request(start, end, RoutingAlgorithm.BFS)), "Shortest path found by BFS:", out);

        out.println();
        out.println("--- Depth-first search (DFS) ---");
        printMazePath(router.route(request(start, end, RoutingAlgorithm.DFS)), "Path found by DFS:", out);
        return EXIT_OK;
    }

    private static void printMazePath(RouteResponse response, String header, PrintStream out) {
        if (!response.isReachable()) {
            out.println("No path found by " + response.getAlgorithm() + ".");
            return;
        }
        out.println(header);
        out.println(String.join(" -> ", response.getPathExternalNodeIds()));
    }

    static int runTransit(TransitNetwork network, String fromToken, String toToken, PrintStream out, PrintStream err) {
        int from;
        int to;
        try {
            from = network.resolveStation(fromToken);
            to = network.resolveStation(toToken);
        } catch (IDMapper.UnknownIDException ex) {
            err.println("Error: " + ex.getMessage());
            printStations(network, err);
            return EXIT_USAGE;
        }
        String fromName = network.stationName(from);
        String toName = network.stationName(to);

        out.println("Routing from '" + fromName + "' to '" + toName + "'...");
        RouteResponse response = network.router().route(request(fromName, toName, RoutingAlgorithm.DIJKSTRA));

        if (!response.isReachable()) {
            out.println("No route available from '" + fromName + "' to '" + toName + "'.");
            return EXIT_OK;
        }
        out.println("Minimum travel time from '" + fromName + "' to '" + toName + "': "
                + response.getTotalCost() + " minutes.");
        if (from == to) {
            out.println("You are already at '" + fromName + "'.");
            return EXIT_OK;
        }
        out.println("Best route:");
        StringBuilder route = new StringBuilder();
        for (String station : response.getPathExternalNodeIds()) {
            route.append("-> ").append(station).append(' ');
        }
        out.println(route.toString().trim());
        return EXIT_OK;
    }

    private static void printStations(TransitNetwork network, PrintStream out) {
        out.println("Available stations:");
        for (int i = 0; i < network.stationCount(); i++) {
            out.printf("%2d. %s%n", i, network.stationName(i));
        }
    }

    private static RouteRequest request(String source, String target, RoutingAlgorithm algorithm) {
        return RouteRequest.builder()
                .sourceExternalId(source)
                .targetExternalId(target)
                .algorithm(algorithm)
                .build();
    }
}
