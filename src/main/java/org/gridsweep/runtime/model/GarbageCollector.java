package org.gridsweep.runtime.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Bags dry and wet trash, leaving dusty or soaked residue behind, and empties its load at a bin.
 * <p>
 * The collector alternates between {@link Mode#COLLECTING} and {@link Mode#RETURNING_TO_BIN}.
 * Once returning it stays committed to the bin trip until the load is emptied.
 */
public class GarbageCollector extends Agent {

    /**
     * Phase of the collector's work cycle.
     */
    public enum Mode {
        COLLECTING,
        RETURNING_TO_BIN
    }

    private static final Set<Cell> BIN_ONLY = EnumSet.of(Cell.BIN);

    private final int capacity;
    private int load = 0;
    private Mode mode = Mode.COLLECTING;

    /**
     * Creates an empty collector.
     *
     * @param position The start position.
     * @param capacity Maximum number of trash cells carried at once, must be positive.
     */
    public GarbageCollector(Position position, int capacity) {
        super(AgentKind.GARBAGE_COLLECTOR, position);
        if (capacity <= 0) {
            throw new IllegalArgumentException("Garbage capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public int load() {
        return load;
    }

    public int capacity() {
        return capacity;
    }

    public Mode mode() {
        return mode;
    }

    public boolean isFull() {
        return load >= capacity;
    }

    /**
     * Switches to {@link Mode#RETURNING_TO_BIN} when the load is full, or when no trash is
     * left anywhere while something is still on board.
     *
     * @param grid The grid to inspect.
     * @return true if the mode changed.
     */
    public boolean updateMode(GridModel grid) {
        if (mode == Mode.COLLECTING && (isFull() || (load > 0 && !grid.contains(Cell.TRASH)))) {
            mode = Mode.RETURNING_TO_BIN;
            return true;
        }
        return false;
    }

    @Override
    public Set<Cell> targetCells(GridModel grid) {
        if (mode == Mode.RETURNING_TO_BIN) {
            return BIN_ONLY;
        }
        if (grid.contains(Cell.TRASH)) {
            return Cell.TRASH;
        }
        return load > 0 ? BIN_ONLY : Set.of();
    }

    @Override
    public int cleanUp(GridModel grid) {
        Cell here = grid.cellAt(position());
        if (here == Cell.BIN) {
            load = 0;
            mode = Mode.COLLECTING;
            return 0;
        }
        if (!Cell.TRASH.contains(here) || isFull()) {
            return 0;
        }
        int work = super.cleanUp(grid);
        load++;
        if (isFull()) {
            mode = Mode.RETURNING_TO_BIN;
        }
        return work;
    }

    @Override
    public int priority() {
        return isFull() ? 2 : 1;
    }

    @Override
    public Agent copy() {
        GarbageCollector copy = new GarbageCollector(position(), capacity);
        copyBaseInto(copy);
        copy.load = this.load;
        copy.mode = this.mode;
        return copy;
    }

    @Override
    public String toString() {
        return super.toString() + " [" + load + "/" + capacity + ", " + mode + "]";
    }
}
