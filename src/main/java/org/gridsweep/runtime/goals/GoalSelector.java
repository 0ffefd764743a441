package org.gridsweep.runtime.goals;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;

import com.typesafe.config.Config;

/**
 * Chooses the cell an agent should head for.
 * <p>
 * Two search modes are available:
 * <ul>
 *   <li><b>Ring search</b> walks outwards by increasing Manhattan radius and returns the first
 *   matching cell. Within a ring, cells are visited row by row, left to right.</li>
 *   <li><b>Best-cell search</b> looks at every matching cell that is at most
 *   {@code comparableSlack} steps further away than the nearest one and prefers cells deep
 *   inside the convex hull of all matching cells. This keeps an agent working into the core
 *   of a cluster instead of oscillating between two equally far outliers.</li>
 * </ul>
 * Hazards are chosen with best-cell search, bins with plain ring search.
 */
public class GoalSelector {

    private final int comparableSlack;
    private final double hullWeight;

    /**
     * Creates a selector.
     *
     * @param comparableSlack How many extra steps still count as "comparably distant", must be &gt;= 0.
     * @param hullWeight Score bonus per unit of hull depth, must be &gt;= 0.
     */
    public GoalSelector(int comparableSlack, double hullWeight) {
        if (comparableSlack < 0) {
            throw new IllegalArgumentException("comparable-slack must be >= 0, got " + comparableSlack);
        }
        if (hullWeight < 0.0) {
            throw new IllegalArgumentException("hull-weight must be >= 0, got " + hullWeight);
        }
        this.comparableSlack = comparableSlack;
        this.hullWeight = hullWeight;
    }

    /**
     * Creates a selector from the {@code simulation.goals} configuration block.
     *
     * @param config Block containing {@code comparable-slack} and {@code hull-weight}.
     */
    public GoalSelector(Config config) {
        this(config.getInt("comparable-slack"), config.getDouble("hull-weight"));
    }

    /**
     * Selects the goal for an agent given its current state.
     *
     * @param agent The agent to select for.
     * @param grid The grid to search.
     * @return The goal cell, or empty if the agent has nothing to do or no target exists.
     */
    public Optional<Position> select(Agent agent, GridModel grid) {
        Set<Cell> targets = agent.targetCells(grid);
        if (targets.isEmpty()) {
            return Optional.empty();
        }
        boolean hazards = targets.stream().anyMatch(Cell::isHazard);
        return hazards
                ? bestCell(grid, agent.position(), targets)
                : nearest(grid, agent.position(), targets);
    }

    /**
     * Checks whether a cached goal still points at a cell the agent wants.
     * Goals may go stale when another agent or an external edit changes the cell.
     *
     * @param agent The agent whose goal is checked.
     * @param grid The current grid.
     * @return true if the agent has a goal and the goal cell matches its targets.
     */
    public boolean isGoalValid(Agent agent, GridModel grid) {
        Position goal = agent.goal();
        return goal != null
                && grid.inBounds(goal)
                && agent.targetCells(grid).contains(grid.cellAt(goal));
    }

    /**
     * Ring search: returns the matching cell with the smallest Manhattan distance.
     *
     * @param grid The grid to search.
     * @param from The search origin.
     * @param types The cell types to look for.
     * @return The first match in ring order.
     */
    public Optional<Position> nearest(GridModel grid, Position from, Set<Cell> types) {
        if (!grid.contains(types)) {
            return Optional.empty();
        }
        int maxRadius = (grid.rows() - 1) + (grid.cols() - 1);
        for (int radius = 0; radius <= maxRadius; radius++) {
            for (int dRow = -radius; dRow <= radius; dRow++) {
                int row = from.row() + dRow;
                if (row < 0 || row >= grid.rows()) {
                    continue;
                }
                int dCol = radius - Math.abs(dRow);
                Position left = new Position(row, from.col() - dCol);
                if (matches(grid, left, types)) {
                    return Optional.of(left);
                }
                if (dCol != 0) {
                    Position right = new Position(row, from.col() + dCol);
                    if (matches(grid, right, types)) {
                        return Optional.of(right);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Best-cell search: scores every comparably near matching cell by
     * {@code distance - hullWeight * hullDepth} and returns the lowest score. Ties keep ring order.
     *
     * @param grid The grid to search.
     * @param from The search origin.
     * @param types The cell types to look for.
     * @return The best cell, or empty if no cell matches.
     */
    public Optional<Position> bestCell(GridModel grid, Position from, Set<Cell> types) {
        Optional<Position> nearest = nearest(grid, from, types);
        if (nearest.isEmpty()) {
            return nearest;
        }
        int window = from.manhattanDistance(nearest.get()) + comparableSlack;
        List<Position> all = grid.cellsOf(types);
        List<Position> candidates = all.stream()
                .filter(cell -> from.manhattanDistance(cell) <= window)
                .collect(Collectors.toList());
        if (candidates.size() <= 1 || hullWeight == 0.0) {
            return nearest;
        }

        HazardHull hull = HazardHull.of(all);
        Comparator<Position> ringOrder = Comparator
                .comparingInt((Position cell) -> from.manhattanDistance(cell))
                .thenComparingInt(Position::row)
                .thenComparingInt(Position::col);
        Comparator<Position> byScore = Comparator
                .comparingDouble((Position cell) -> from.manhattanDistance(cell) - hullWeight * hull.depth(cell))
                .thenComparing(ringOrder);
        return candidates.stream().min(byScore);
    }

    private static boolean matches(GridModel grid, Position pos, Set<Cell> types) {
        return grid.inBounds(pos) && types.contains(grid.cellAt(pos));
    }
}
