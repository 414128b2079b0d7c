package org.Aayush.wayfinder.app;

import org.Aayush.wayfinder.transit.TransitNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    @DisplayName("No arguments solves the bundled maze")
    void testDefaultMaze() {
        assertEquals(Main.EXIT_OK, Main.run(new String[0], out, err));

        String output = out();
        assertTrue(output.startsWith("Maze:\n# # # # # # # # # # \n# S . # . . . # E # \n"));
        assertTrue(output.contains("--- Breadth-first search (BFS) ---\nShortest path found by BFS:\n(1, 1) -> (2, 1)"));
        assertTrue(output.contains("(3, 8) -> (2, 8) -> (1, 8)\n\n--- Depth-first search (DFS) ---\nPath found by DFS:\n"));
        assertTrue(output.contains("(4, 6) -> (5, 6) -> (6, 6)"));
        assertEquals("", err());
    }

    @Test
    @DisplayName("Maze file argument is loaded and solved")
    void testMazeFile() throws IOException {
        Path file = tempDir.resolve("small.txt");
        Files.writeString(file, "####\n#S.#\n#.E#\n####\n", StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_OK, Main.run(new String[]{"maze", file.toString()}, out, err));
        assertTrue(out().contains("Shortest path found by BFS:\n(1, 1) -> (2, 1) -> (2, 2)\n"));
        assertTrue(out().contains("Path found by DFS:\n(1, 1) -> (2, 1) -> (2, 2)\n"));
    }

    @Test
    @DisplayName("Unsolvable maze reports no path for both searches")
    void testUnsolvableMaze() throws IOException {
        Path file = tempDir.resolve("walled.txt");
        Files.writeString(file, "#####\n#S#E#\n#####\n", StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_OK, Main.run(new String[]{"maze", file.toString()}, out, err));
        assertTrue(out().contains("No path found by BFS."));
        assertTrue(out().contains("No path found by DFS."));
    }

    @Test
    @DisplayName("Maze without a start marker is a recoverable error")
    void testMissingStart() throws IOException {
        Path file = tempDir.resolve("no-start.txt");
        Files.writeString(file, "#.E#\n", StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"maze", file.toString()}, out, err));
        assertEquals("Error: start marker 'S' not found in maze\n", err());
    }

    @Test
    @DisplayName("Unreadable maze file is a recoverable error")
    void testMissingFile() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"maze", tempDir.resolve("absent").toString()}, out, err));
        assertTrue(err().startsWith("Error: cannot read maze:"));
    }

    @Test
    @DisplayName("Transit prints time and route")
    void testTransit() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"transit", "Centro", "Praia"}, out, err));

        assertEquals("Routing from 'Centro' to 'Praia'...\n"
                + "Minimum travel time from 'Centro' to 'Praia': 41 minutes.\n"
                + "Best route:\n"
                + "-> Centro -> Shopping -> Hospital -> Praia\n", out());
    }

    @Test
    @DisplayName("Transit accepts station indices")
    void testTransitByIndex() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"transit", "0", "9"}, out, err));
        assertTrue(out().contains("Minimum travel time from 'Centro' to 'Terminal Central': 63 minutes."));
    }

    @Test
    @DisplayName("Transit to the same station")
    void testTransitSameStation() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"transit", "Praia", "6"}, out, err));
        assertEquals("Routing from 'Praia' to 'Praia'...\n"
                + "Minimum travel time from 'Praia' to 'Praia': 0 minutes.\n"
                + "You are already at 'Praia'.\n", out());
    }

    @Test
    @DisplayName("Transit to an unreachable station")
    void testTransitUnreachable() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"transit", "Centro", "Bairro Norte"}, out, err));
        assertTrue(out().endsWith("No route available from 'Centro' to 'Bairro Norte'.\n"));
    }

    @Test
    @DisplayName("Unknown station lists the valid ones")
    void testTransitUnknownStation() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"transit", "Lua", "Centro"}, out, err));
        assertTrue(err().startsWith("Error: Unknown station: Lua\nAvailable stations:\n"));
        assertTrue(err().contains(" 9. Terminal Central\n"));
        assertEquals("", out());
    }

    @Test
    @DisplayName("Custom network through the transit entry point")
    void testRunTransitCustomNetwork() {
        TransitNetwork network = TransitNetwork.builder()
                .stations("Up", "Down")
                .connection("Up", "Down", 3)
                .build();

        assertEquals(Main.EXIT_OK, Main.runTransit(network, "Up", "Down", out, err));
        assertTrue(out().contains("Minimum travel time from 'Up' to 'Down': 3 minutes."));
    }

    @Test
    @DisplayName("Stations command lists the reference network")
    void testStations() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"stations"}, out, err));
        assertTrue(out().startsWith("Available stations:\n 0. Centro\n 1. Rodoviaria\n"));
    }

    @Test
    @DisplayName("Usage errors")
    void testUsage() {
        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"transit", "Centro"}, out, err));
        assertEquals("Usage: transit FROM TO\n", err());

        assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"fly"}, out, err));
        assertTrue(err().contains("Unknown command: fly"));
    }
}
