package org.Aayush.wayfinder.core.id;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row-major mapping between grid cells and flat node indices.
 * <p>
 * {@code index = row * columns + column}. External ids use the rendered form
 * {@code "(row, column)"}; parsing also accepts the bare {@code "row,column"} form.
 * Stateless apart from the dimensions, so it is safe for concurrent reads.
 */
@Getter
@Accessors(fluent = true)
public final class GridIDMapper implements IDMapper {

    private static final Pattern CELL_PATTERN =
            Pattern.compile("^\\(?\\s*(-?\\d{1,9})\\s*,\\s*(-?\\d{1,9})\\s*\\)?$");

    private final int rows;
    private final int columns;

    /**
     * @param rows number of grid rows, positive.
     * @param columns number of grid columns, positive.
     */
    public GridIDMapper(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + columns);
        }
        if ((long) rows * columns > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid too large for int node ids: " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
    }

    /**
     * One grid position.
     */
    public record Cell(int row, int column) {
        @Override
        public String toString() {
            return "(" + row + ", " + column + ")";
        }
    }

    public boolean isValid(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    /**
     * Flattens a cell into its node index.
     *
     * @throws IndexOutOfBoundsException when the cell lies outside the grid.
     */
    public int toIndex(int row, int column) {
        if (!isValid(row, column)) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + column + ") out of bounds");
        }
        return row * columns + column;
    }

    /**
     * Expands a node index back into its cell.
     *
     * @throws IndexOutOfBoundsException when the index is outside {@code [0, rows * columns)}.
     */
    public Cell toCell(int index) {
        checkIndex(index);
        return new Cell(index / columns, index % columns);
    }

    public int rowOf(int index) {
        checkIndex(index);
        return index / columns;
    }

    public int columnOf(int index) {
        checkIndex(index);
        return index % columns;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int index = parse(externalId);
        if (index < 0) {
            throw new UnknownIDException("Not a cell of the " + rows + "x" + columns + " grid: " + externalId);
        }
        return index;
    }

    @Override
    public String toExternal(int internalId) {
        return toCell(internalId).toString();
    }

    @Override
    public boolean containsExternal(String externalId) {
        return parse(externalId) >= 0;
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < size();
    }

    @Override
    public int size() {
        return rows * columns;
    }

    /**
     * Node index of a cell id, or -1 when the id is malformed or outside the grid.
     */
    private int parse(String externalId) {
        if (externalId == null) {
            return -1;
        }
        Matcher matcher = CELL_PATTERN.matcher(externalId.trim());
        if (!matcher.matches()) {
            return -1;
        }
        int row = Integer.parseInt(matcher.group(1));
        int column = Integer.parseInt(matcher.group(2));
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            return -1;
        }
        return row * columns + column;
    }

    private void checkIndex(int index) {
        if (!containsInternal(index)) {
            throw new IndexOutOfBoundsException("Node " + index + " out of bounds");
        }
    }
}
