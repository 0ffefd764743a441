package org.gridsweep.runtime.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The state of a single grid cell.
 * <p>
 * Hazard cells carry work units: trash needs two clean-ups (bagging, then
 * clearing the residue), residue needs one.
 */
public enum Cell {
    EMPTY('.', 0),
    DRY_TRASH('t', 2),
    WET_TRASH('w', 2),
    DUSTY('d', 1),
    SOAKED('s', 1),
    BIN('B', 0),
    WALL('#', 0);

    /** All cell types an agent has to neutralize. */
    public static final Set<Cell> HAZARDS =
            Collections.unmodifiableSet(EnumSet.of(DRY_TRASH, WET_TRASH, DUSTY, SOAKED));

    /** Trash cells handled by the garbage collector. */
    public static final Set<Cell> TRASH = Collections.unmodifiableSet(EnumSet.of(DRY_TRASH, WET_TRASH));

    private final char symbol;
    private final int workUnits;

    Cell(char symbol, int workUnits) {
        this.symbol = symbol;
        this.workUnits = workUnits;
    }

    /**
     * Returns the single character used by {@link GridModel#render()}.
     * @return The display symbol.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Returns how many clean-ups this cell still needs before it is empty.
     * @return Remaining work units, 0 for non-hazard cells.
     */
    public int workUnits() {
        return workUnits;
    }

    public boolean isHazard() {
        return HAZARDS.contains(this);
    }

    /**
     * Checks whether clean-up may change this cell.
     * @return false for {@link #WALL} and {@link #BIN}.
     */
    public boolean isStructural() {
        return this == WALL || this == BIN;
    }

    /**
     * Parses a display symbol back into a cell.
     * @param symbol The symbol produced by {@link #symbol()}.
     * @return The matching cell.
     * @throws IllegalArgumentException if no cell uses the symbol.
     */
    public static Cell fromSymbol(char symbol) {
        for (Cell cell : values()) {
            if (cell.symbol == symbol) {
                return cell;
            }
        }
        throw new IllegalArgumentException("Unknown cell symbol: '" + symbol + "'");
    }
}
