package org.gridsweep.runtime.planning;

import java.util.Set;

import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;

/**
 * Single-agent path search on the grid. Implementations only search; callers decide what to
 * do with a failed plan.
 */
public interface IPathPlanner {

    /**
     * Finds a shortest path between two cells, avoiding walls.
     *
     * @param grid The grid to search.
     * @param start The start cell.
     * @param goal The goal cell.
     * @return The moves from start to goal, or a failure result if the goal is unreachable.
     */
    default PathResult findPath(GridModel grid, Position start, Position goal) {
        return findPath(grid, start, goal, Set.of());
    }

    /**
     * Finds a shortest path that additionally avoids a set of blocked cells, e.g. cells
     * currently occupied by other agents. The goal itself is never treated as blocked.
     *
     * @param grid The grid to search.
     * @param start The start cell.
     * @param goal The goal cell.
     * @param blocked Cells that may not be entered.
     * @return The moves from start to goal, or a failure result.
     */
    PathResult findPath(GridModel grid, Position start, Position goal, Set<Position> blocked);
}
