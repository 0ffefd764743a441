package org.gridsweep.runtime.model;

/**
 * A grid coordinate. Rows grow downwards, columns grow to the right.
 * @param row The row index.
 * @param col The column index.
 */
public record Position(int row, int col) {

    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    /**
     * Computes the Manhattan distance to another position.
     * @param other The other position.
     * @return |dRow| + |dCol|.
     */
    public int manhattanDistance(Position other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col);
    }

    /**
     * Returns the position reached by applying a move. No bounds check is performed.
     * @param move The move to apply.
     * @return The translated position.
     */
    public Position apply(Move move) {
        if (move == Move.STAY) {
            return this;
        }
        return new Position(row + move.dRow(), col + move.dCol());
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
