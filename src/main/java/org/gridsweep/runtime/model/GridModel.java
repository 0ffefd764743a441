package org.gridsweep.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Owns the 2D cell-state array of a run.
 * <p>
 * Cells are stored row-major in a flat array. A per-type index of flat indices is kept in
 * sync with every mutation so that hazard lookups and the termination check do not need a
 * full scan. All mutations are immediate and visible to every agent stepped afterwards.
 * <p>
 * Agents never hold a reference to the grid; controllers pass it into each decision routine.
 */
public class GridModel {
    private final int rows;
    private final int cols;
    private final Cell[] cells;

    // Flat indices per cell type, EMPTY is not tracked
    private final Map<Cell, IntOpenHashSet> cellsByType;

    // Incremented by paint(), never by clean-up; lets controllers detect out-of-band edits
    private long editVersion = 0L;

    /**
     * Creates an all-empty grid.
     *
     * @param rows Number of rows, must be positive.
     * @param cols Number of columns, must be positive.
     */
    public GridModel(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + rows + "x" + cols);
        }
        long size = (long) rows * cols;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid too large: " + size + " cells exceeds Integer.MAX_VALUE.");
        }
        this.rows = rows;
        this.cols = cols;
        this.cells = new Cell[(int) size];
        Arrays.fill(this.cells, Cell.EMPTY);
        this.cellsByType = new EnumMap<>(Cell.class);
        for (Cell cell : Cell.values()) {
            if (cell != Cell.EMPTY) {
                cellsByType.put(cell, new IntOpenHashSet());
            }
        }
    }

    /**
     * Parses a grid from rows of {@link Cell#symbol()} characters. Whitespace inside a row is ignored.
     *
     * @param lines One string per row, all of equal length.
     * @return The parsed grid.
     */
    public static GridModel parse(String... lines) {
        if (lines.length == 0) {
            throw new IllegalArgumentException("At least one row is required.");
        }
        String[] stripped = new String[lines.length];
        for (int i = 0; i < lines.length; i++) {
            stripped[i] = lines[i].replaceAll("\\s", "");
        }
        GridModel grid = new GridModel(stripped.length, stripped[0].length());
        for (int r = 0; r < stripped.length; r++) {
            if (stripped[r].length() != grid.cols) {
                throw new IllegalArgumentException("Row " + r + " has " + stripped[r].length()
                        + " cells, expected " + grid.cols);
            }
            for (int c = 0; c < grid.cols; c++) {
                grid.write(r * grid.cols + c, Cell.fromSymbol(stripped[r].charAt(c)));
            }
        }
        return grid;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int area() {
        return cells.length;
    }

    public boolean inBounds(Position pos) {
        return pos.row() >= 0 && pos.row() < rows && pos.col() >= 0 && pos.col() < cols;
    }

    /**
     * Checks whether an agent may stand on the given position.
     * @param pos The position to check.
     * @return true if the position is inside the grid and not a wall.
     */
    public boolean isWalkable(Position pos) {
        return inBounds(pos) && cells[flatIndex(pos)] != Cell.WALL;
    }

    /**
     * Returns the cell at a position.
     * @param pos The position to read.
     * @return The cell state.
     * @throws IllegalArgumentException if the position is outside the grid.
     */
    public Cell cellAt(Position pos) {
        return cells[checkedIndex(pos)];
    }

    /**
     * Applies the clean-up of the given agent kind to a cell.
     * <ul>
     *   <li>Garbage collector: DRY_TRASH becomes DUSTY, WET_TRASH becomes SOAKED.</li>
     *   <li>Vacuum: DUSTY becomes EMPTY.</li>
     *   <li>Mop: SOAKED becomes EMPTY.</li>
     * </ul>
     * Walls, bins and cells outside the acting kind's affinity are left untouched.
     *
     * @param pos The cell to clean.
     * @param actingKind The kind of agent performing the clean-up.
     * @return The cell state before the clean-up.
     */
    public Cell cleanUp(Position pos, AgentKind actingKind) {
        int index = checkedIndex(pos);
        Cell before = cells[index];
        if (before.isStructural()) {
            return before;
        }
        Cell after = switch (actingKind) {
            case GARBAGE_COLLECTOR -> switch (before) {
                case DRY_TRASH -> Cell.DUSTY;
                case WET_TRASH -> Cell.SOAKED;
                default -> before;
            };
            case VACUUM -> before == Cell.DUSTY ? Cell.EMPTY : before;
            case MOP -> before == Cell.SOAKED ? Cell.EMPTY : before;
        };
        if (after != before) {
            write(index, after);
        }
        return before;
    }

    /**
     * Overwrites a cell from outside the simulation core, e.g. a brush stroke in an editor.
     * Unlike {@link #cleanUp(Position, AgentKind)} this may place or remove walls and bins.
     *
     * @param pos The cell to overwrite.
     * @param cell The new state.
     */
    public void paint(Position pos, Cell cell) {
        write(checkedIndex(pos), cell);
        editVersion++;
    }

    /**
     * Returns a counter that changes whenever {@link #paint(Position, Cell)} is called.
     * @return The out-of-band edit version.
     */
    public long editVersion() {
        return editVersion;
    }

    /**
     * Checks whether any cell of the given types is present, using the type index.
     * @param types The cell types to look for.
     * @return true if at least one such cell exists.
     */
    public boolean contains(Set<Cell> types) {
        for (Cell type : types) {
            if (type != Cell.EMPTY && !cellsByType.get(type).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts cells of one type using the type index.
     * @param type The cell type, must not be EMPTY.
     * @return The number of such cells.
     */
    public int count(Cell type) {
        if (type == Cell.EMPTY) {
            throw new IllegalArgumentException("EMPTY cells are not indexed.");
        }
        return cellsByType.get(type).size();
    }

    /**
     * Lists every cell of the given types in row-major order.
     * @param types The cell types to collect.
     * @return Matching positions, sorted row-major.
     */
    public List<Position> cellsOf(Set<Cell> types) {
        IntOpenHashSet merged = new IntOpenHashSet();
        for (Cell type : types) {
            if (type != Cell.EMPTY) {
                merged.addAll(cellsByType.get(type));
            }
        }
        int[] indices = merged.toIntArray();
        Arrays.sort(indices);
        List<Position> result = new ArrayList<>(indices.length);
        for (int index : indices) {
            result.add(positionOf(index));
        }
        return result;
    }

    /**
     * Visits every flat index in row-major order without consulting the type index.
     * Used by checks that must not trust the index.
     *
     * @param consumer Callback invoked with each flat index.
     */
    public void forEachIndex(IntConsumer consumer) {
        for (int i = 0; i < cells.length; i++) {
            consumer.accept(i);
        }
    }

    /**
     * Reads a cell by flat index.
     * @param flatIndex Row-major index.
     * @return The cell state.
     */
    public Cell cellAtIndex(int flatIndex) {
        return cells[flatIndex];
    }

    public Position positionOf(int flatIndex) {
        return new Position(flatIndex / cols, flatIndex % cols);
    }

    public int flatIndex(Position pos) {
        return pos.row() * cols + pos.col();
    }

    /**
     * Creates an independent copy, including the edit version.
     * @return A deep copy of this grid.
     */
    public GridModel copy() {
        GridModel copy = new GridModel(rows, cols);
        copy.restoreFrom(this);
        return copy;
    }

    /**
     * Overwrites this grid with the contents of another grid of the same shape.
     * @param other The grid to copy from.
     */
    public void restoreFrom(GridModel other) {
        if (other.rows != rows || other.cols != cols) {
            throw new IllegalArgumentException("Cannot restore a " + rows + "x" + cols
                    + " grid from a " + other.rows + "x" + other.cols + " grid.");
        }
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != other.cells[i]) {
                write(i, other.cells[i]);
            }
        }
        this.editVersion = other.editVersion;
    }

    /**
     * Renders the grid as one line per row using {@link Cell#symbol()}.
     * @return The rendered grid.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(cells.length + rows);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                sb.append(cells[r * cols + c].symbol());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void write(int index, Cell cell) {
        Cell old = cells[index];
        if (old != Cell.EMPTY) {
            cellsByType.get(old).remove(index);
        }
        cells[index] = cell;
        if (cell != Cell.EMPTY) {
            cellsByType.get(cell).add(index);
        }
    }

    private int checkedIndex(Position pos) {
        if (!inBounds(pos)) {
            throw new IllegalArgumentException("Position " + pos + " is outside the "
                    + rows + "x" + cols + " grid.");
        }
        return flatIndex(pos);
    }
}
