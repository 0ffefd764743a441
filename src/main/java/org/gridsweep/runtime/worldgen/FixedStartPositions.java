package org.gridsweep.runtime.worldgen;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.spi.IStartPositionProvider;

/**
 * Places agents at fixed positions.
 * <p>
 * Without explicit positions the defaults are: garbage collector top-left, vacuum top-right,
 * mop bottom-left. On single-row or single-column grids corners coincide; a default corner that
 * is already taken is replaced by the first free walkable cell in row-major order.
 */
public class FixedStartPositions implements IStartPositionProvider {

    private final Map<AgentKind, Position> explicit;

    /**
     * Uses the corner defaults.
     */
    public FixedStartPositions() {
        this(Map.of());
    }

    /**
     * Uses explicit positions, falling back to the corner defaults for missing kinds.
     * @param explicit Positions per kind.
     */
    public FixedStartPositions(Map<AgentKind, Position> explicit) {
        this.explicit = explicit.isEmpty() ? Map.of() : new EnumMap<>(explicit);
    }

    @Override
    public Map<AgentKind, Position> startPositions(GridModel grid) {
        Map<AgentKind, Position> result = new EnumMap<>(AgentKind.class);
        Set<Position> taken = new HashSet<>();
        for (AgentKind kind : AgentKind.values()) {
            Position pos = explicit.get(kind);
            if (pos == null) {
                pos = corner(kind, grid);
                if (taken.contains(pos)) {
                    pos = firstFreeCell(grid, taken, kind);
                }
            }
            if (!grid.isWalkable(pos)) {
                throw new IllegalArgumentException("Start position " + pos + " for " + kind
                        + " is not walkable on a " + grid.rows() + "x" + grid.cols() + " grid.");
            }
            if (!taken.add(pos)) {
                throw new IllegalArgumentException("Start position " + pos + " for " + kind
                        + " is already taken by another agent.");
            }
            result.put(kind, pos);
        }
        return result;
    }

    private static Position firstFreeCell(GridModel grid, Set<Position> taken, AgentKind kind) {
        for (int index = 0; index < grid.area(); index++) {
            Position candidate = grid.positionOf(index);
            if (grid.isWalkable(candidate) && !taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("No free walkable cell left for " + kind + " on a "
                + grid.rows() + "x" + grid.cols() + " grid.");
    }

    private static Position corner(AgentKind kind, GridModel grid) {
        return switch (kind) {
            case GARBAGE_COLLECTOR -> new Position(0, 0);
            case VACUUM -> new Position(0, grid.cols() - 1);
            case MOP -> new Position(grid.rows() - 1, 0);
        };
    }
}
