package org.Aayush.wayfinder.maze;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.wayfinder.core.id.GridIDMapper;
import org.Aayush.wayfinder.routing.path.NodePath;

import java.util.List;
import java.util.Objects;

/**
 * Immutable rectangular character maze.
 * <p>
 * {@code #} is a wall; every other character is an open cell. Exactly one {@code S} (start)
 * and one {@code E} (end) are required.
 */
@Getter
@Accessors(fluent = true)
public final class MazeGrid {
    public static final char WALL = '#';
    public static final char START = 'S';
    public static final char END = 'E';
    public static final char PATH_MARK = '*';

    private final int rows;
    private final int columns;
    private final GridIDMapper.Cell start;
    private final GridIDMapper.Cell end;
    @Getter(AccessLevel.NONE)
    private final char[][] cells;

    private MazeGrid(char[][] cells, GridIDMapper.Cell start, GridIDMapper.Cell end) {
        this.cells = cells;
        this.rows = cells.length;
        this.columns = cells[0].length;
        this.start = start;
        this.end = end;
    }

    /**
     * Parses maze lines, one string per row.
     *
     * @throws MalformedMazeException when the input is empty, ragged, or has repeated markers.
     * @throws MissingEndpointException when {@code S} or {@code E} is absent.
     */
    public static MazeGrid parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            throw new MalformedMazeException("maze has no rows");
        }
        int columns = lines.get(0) == null ? 0 : lines.get(0).length();
        if (columns == 0) {
            throw new MalformedMazeException("maze row 0 is empty");
        }

        char[][] cells = new char[lines.size()][];
        GridIDMapper.Cell start = null;
        GridIDMapper.Cell end = null;
        for (int r = 0; r < lines.size(); r++) {
            String line = lines.get(r);
            if (line == null || line.length() != columns) {
                throw new MalformedMazeException(
                        "maze row " + r + " has length " + (line == null ? 0 : line.length()) + ", expected " + columns
                );
            }
            cells[r] = line.toCharArray();
            for (int c = 0; c < columns; c++) {
                if (cells[r][c] == START) {
                    start = single(start, r, c, START);
                } else if (cells[r][c] == END) {
                    end = single(end, r, c, END);
                }
            }
        }
        if (start == null) {
            throw new MissingEndpointException(START, "start marker '" + START + "' not found in maze");
        }
        if (end == null) {
            throw new MissingEndpointException(END, "end marker '" + END + "' not found in maze");
        }
        return new MazeGrid(cells, start, end);
    }

    private static GridIDMapper.Cell single(GridIDMapper.Cell existing, int r, int c, char marker) {
        if (existing != null) {
            throw new MalformedMazeException(
                    "marker '" + marker + "' appears at " + existing + " and (" + r + ", " + c + ")"
            );
        }
        return new GridIDMapper.Cell(r, c);
    }

    public char charAt(int row, int column) {
        if (!isInside(row, column)) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + column + ") out of bounds");
        }
        return cells[row][column];
    }

    public boolean isInside(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /**
     * True for in-bounds non-wall cells.
     */
    public boolean isOpen(int row, int column) {
        return isInside(row, column) && cells[row][column] != WALL;
    }

    /**
     * Renders each cell followed by a space, one row per line.
     */
    public String render() {
        return render(new IntOpenHashSet());
    }

    /**
     * Renders the maze with {@link #PATH_MARK} on the path's interior cells.
     */
    public String render(NodePath path) {
        Objects.requireNonNull(path, "path");
        return render(new IntOpenHashSet(path.toArray()));
    }

    private String render(IntSet marked) {
        StringBuilder sb = new StringBuilder(rows * (columns * 2 + 1));
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                char ch = cells[r][c];
                if (ch != START && ch != END && marked.contains(r * columns + c)) {
                    ch = PATH_MARK;
                }
                sb.append(ch).append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
