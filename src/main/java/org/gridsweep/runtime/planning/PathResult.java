package org.gridsweep.runtime.planning;

import java.util.Collections;
import java.util.List;

import org.gridsweep.runtime.model.Move;

/**
 * Outcome of a path search: either an ordered list of unit moves or a planning failure.
 *
 * @param success Whether a path was found.
 * @param moves The moves from start to goal; empty on failure or when start equals goal.
 * @param expanded Number of nodes taken from the open list, for diagnostics.
 */
public record PathResult(boolean success, List<Move> moves, int expanded) {

    public PathResult {
        moves = moves == null ? List.of() : Collections.unmodifiableList(moves);
    }

    public static PathResult success(List<Move> moves, int expanded) {
        return new PathResult(true, moves, expanded);
    }

    public static PathResult failure(int expanded) {
        return new PathResult(false, List.of(), expanded);
    }

    public int length() {
        return moves.size();
    }

    /**
     * Returns the first move of the path.
     * @return The first move, or {@link Move#STAY} for failed or empty paths.
     */
    public Move firstMove() {
        return moves.isEmpty() ? Move.STAY : moves.get(0);
    }
}
