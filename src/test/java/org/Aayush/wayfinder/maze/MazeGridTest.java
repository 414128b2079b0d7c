package org.Aayush.wayfinder.maze;

import org.Aayush.wayfinder.core.id.GridIDMapper;
import org.Aayush.wayfinder.routing.path.NodePath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazeGrid")
class MazeGridTest {

    private static final List<String> SMALL = List.of(
            "####",
            "#S.#",
            "#.E#",
            "####"
    );

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Locates markers and dimensions")
        void testParse() {
            MazeGrid grid = MazeGrid.parse(SMALL);

            assertEquals(4, grid.rows());
            assertEquals(4, grid.columns());
            assertEquals(new GridIDMapper.Cell(1, 1), grid.start());
            assertEquals(new GridIDMapper.Cell(2, 2), grid.end());
            assertEquals('.', grid.charAt(1, 2));
        }

        @Test
        @DisplayName("Anything but a wall is open, including markers")
        void testOpenCells() {
            MazeGrid grid = MazeGrid.parse(List.of("#S x", "E###"));

            assertFalse(grid.isOpen(0, 0));
            assertTrue(grid.isOpen(0, 1));
            assertTrue(grid.isOpen(0, 2));
            assertTrue(grid.isOpen(0, 3));
            assertTrue(grid.isOpen(1, 0));
            assertFalse(grid.isOpen(-1, 0));
            assertFalse(grid.isOpen(0, 4));
        }

        @Test
        @DisplayName("Missing start marker")
        void testMissingStart() {
            MissingEndpointException ex = assertThrows(MissingEndpointException.class,
                    () -> MazeGrid.parse(List.of("#.E#")));
            assertEquals('S', ex.getMarker());
            assertEquals("start marker 'S' not found in maze", ex.getMessage());
        }

        @Test
        @DisplayName("Missing end marker")
        void testMissingEnd() {
            MissingEndpointException ex = assertThrows(MissingEndpointException.class,
                    () -> MazeGrid.parse(List.of("#S.#")));
            assertEquals('E', ex.getMarker());
        }

        @Test
        @DisplayName("Empty, ragged and doubled-marker mazes are malformed")
        void testMalformed() {
            assertThrows(MalformedMazeException.class, () -> MazeGrid.parse(List.of()));
            assertThrows(MalformedMazeException.class, () -> MazeGrid.parse(List.of("")));
            assertThrows(MalformedMazeException.class, () -> MazeGrid.parse(List.of("#S#", "#E")));
            assertThrows(MalformedMazeException.class, () -> MazeGrid.parse(List.of("SSE")));
            assertThrows(MalformedMazeException.class, () -> MazeGrid.parse(Arrays.asList("S.E", null)));
        }

        @Test
        @DisplayName("Cell access outside the grid is a bounds error")
        void testCharAtBounds() {
            MazeGrid grid = MazeGrid.parse(SMALL);
            assertThrows(IndexOutOfBoundsException.class, () -> grid.charAt(4, 0));
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Each cell is followed by a space, one row per line")
        void testRender() {
            String expected = "# # # # \n"
                    + "# S . # \n"
                    + "# . E # \n"
                    + "# # # # \n";

            assertEquals(expected, MazeGrid.parse(SMALL).render());
        }

        @Test
        @DisplayName("Path overlay marks interior cells and keeps the markers")
        void testRenderPath() {
            MazeGrid grid = MazeGrid.parse(SMALL);
            // (1,1) -> (2,1) -> (2,2) on a 4-column grid
            NodePath path = NodePath.of(5, 9, 10);

            String expected = "# # # # \n"
                    + "# S . # \n"
                    + "# * E # \n"
                    + "# # # # \n";

            assertEquals(expected, grid.render(path));
            assertEquals(grid.render(), grid.render(NodePath.empty()));
        }
    }
}
