package org.gridsweep.runtime.model;

import java.util.List;

/**
 * A discrete agent move. Paths only ever contain the four unit moves; {@link #STAY}
 * is an extra candidate considered by collision avoidance.
 */
public enum Move {
    STAY(0, 0),
    UP(-1, 0),
    DOWN(1, 0),
    LEFT(0, -1),
    RIGHT(0, 1);

    /** Unit moves in neighbour expansion order. */
    public static final List<Move> DIRECTIONS = List.of(UP, DOWN, LEFT, RIGHT);

    /** Every candidate move, staying put first. */
    public static final List<Move> CANDIDATES = List.of(STAY, UP, DOWN, LEFT, RIGHT);

    private final int dRow;
    private final int dCol;

    Move(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public int dRow() {
        return dRow;
    }

    public int dCol() {
        return dCol;
    }

    /**
     * Finds the unit move that leads from one position to an adjacent one.
     * @param from The start position.
     * @param to The adjacent target position.
     * @return The connecting move, or {@link #STAY} if both positions are equal.
     * @throws IllegalArgumentException if the positions are not adjacent.
     */
    public static Move between(Position from, Position to) {
        for (Move move : CANDIDATES) {
            if (from.apply(move).equals(to)) {
                return move;
            }
        }
        throw new IllegalArgumentException("Positions are not adjacent: " + from + " -> " + to);
    }
}
