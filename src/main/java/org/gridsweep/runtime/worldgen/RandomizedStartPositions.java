package org.gridsweep.runtime.worldgen;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.spi.IRandomProvider;
import org.gridsweep.runtime.spi.IStartPositionProvider;

/**
 * Places each agent on a random cell of its own hazard type, or on a random walkable cell
 * when no such hazard exists yet. Agents never share a start cell.
 */
public class RandomizedStartPositions implements IStartPositionProvider {

    private final IRandomProvider random;

    public RandomizedStartPositions(IRandomProvider random) {
        this.random = random;
    }

    @Override
    public Map<AgentKind, Position> startPositions(GridModel grid) {
        if (grid.area() < AgentKind.values().length) {
            throw new IllegalArgumentException("Grid of " + grid.area() + " cells cannot hold "
                    + AgentKind.values().length + " agents.");
        }
        Map<AgentKind, Position> result = new EnumMap<>(AgentKind.class);
        Set<Position> taken = new HashSet<>();
        for (AgentKind kind : AgentKind.values()) {
            List<Position> options = grid.cellsOf(affinity(kind)).stream()
                    .filter(pos -> !taken.contains(pos))
                    .collect(Collectors.toList());
            if (options.isEmpty()) {
                options = walkableCells(grid).stream()
                        .filter(pos -> !taken.contains(pos))
                        .collect(Collectors.toList());
            }
            if (options.isEmpty()) {
                throw new IllegalArgumentException("No free walkable cell left for " + kind);
            }
            Position pos = options.get(random.nextInt(options.size()));
            taken.add(pos);
            result.put(kind, pos);
        }
        return result;
    }

    private static Set<Cell> affinity(AgentKind kind) {
        return switch (kind) {
            case GARBAGE_COLLECTOR -> Cell.TRASH;
            case VACUUM -> EnumSet.of(Cell.DUSTY);
            case MOP -> EnumSet.of(Cell.SOAKED);
        };
    }

    private static List<Position> walkableCells(GridModel grid) {
        List<Position> cells = new ArrayList<>();
        grid.forEachIndex(index -> {
            Position pos = grid.positionOf(index);
            if (grid.isWalkable(pos)) {
                cells.add(pos);
            }
        });
        return cells;
    }
}
