package org.gridsweep.runtime.planning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * A* search over the 4-connected grid with unit move costs and a Manhattan heuristic.
 * <p>
 * The open list is a plain binary heap without decrease-key. Improved entries are pushed
 * again and stale ones are skipped when polled. Neighbours are expanded in the fixed order
 * of {@link Move#DIRECTIONS}, and heap ties are broken by depth and then insertion order, so
 * equal inputs always produce the same path.
 * <p>
 * The closed set is bounded by the grid area, which guarantees termination on disconnected
 * grids.
 */
public class AStarPathPlanner implements IPathPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(AStarPathPlanner.class);

    @Override
    public PathResult findPath(GridModel grid, Position start, Position goal, Set<Position> blocked) {
        if (!grid.inBounds(start) || !grid.inBounds(goal) || !grid.isWalkable(goal)) {
            LOG.debug("No path {} -> {}: goal not walkable or out of bounds", start, goal);
            return PathResult.failure(0);
        }
        if (start.equals(goal)) {
            return PathResult.success(Collections.emptyList(), 0);
        }

        int startIndex = grid.flatIndex(start);
        int goalIndex = grid.flatIndex(goal);

        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        Int2IntOpenHashMap bestG = new Int2IntOpenHashMap();
        bestG.defaultReturnValue(Integer.MAX_VALUE);
        Int2IntOpenHashMap cameFrom = new Int2IntOpenHashMap();
        IntOpenHashSet closed = new IntOpenHashSet();

        long sequence = 0;
        open.add(new SearchNode(startIndex, 0, start.manhattanDistance(goal), sequence++));
        bestG.put(startIndex, 0);

        int expanded = 0;
        while (!open.isEmpty() && closed.size() < grid.area()) {
            SearchNode current = open.poll();
            if (current.g > bestG.get(current.index) || closed.contains(current.index)) {
                continue; // stale heap entry
            }
            expanded++;
            if (current.index == goalIndex) {
                return PathResult.success(reconstruct(grid, cameFrom, startIndex, goalIndex), expanded);
            }
            closed.add(current.index);

            Position here = grid.positionOf(current.index);
            for (Move move : Move.DIRECTIONS) {
                Position next = here.apply(move);
                if (!grid.isWalkable(next) || (blocked.contains(next) && !next.equals(goal))) {
                    continue;
                }
                int nextIndex = grid.flatIndex(next);
                if (closed.contains(nextIndex)) {
                    continue;
                }
                int g = current.g + 1;
                if (g < bestG.get(nextIndex)) {
                    bestG.put(nextIndex, g);
                    cameFrom.put(nextIndex, current.index);
                    open.add(new SearchNode(nextIndex, g, g + next.manhattanDistance(goal), sequence++));
                }
            }
        }

        LOG.debug("No path {} -> {} after expanding {} nodes", start, goal, expanded);
        return PathResult.failure(expanded);
    }

    private List<Move> reconstruct(GridModel grid, Int2IntOpenHashMap cameFrom, int startIndex, int goalIndex) {
        List<Move> moves = new ArrayList<>();
        int index = goalIndex;
        while (index != startIndex) {
            int parent = cameFrom.get(index);
            moves.add(Move.between(grid.positionOf(parent), grid.positionOf(index)));
            index = parent;
        }
        Collections.reverse(moves);
        return moves;
    }

    private static final class SearchNode implements Comparable<SearchNode> {
        final int index;
        final int g;
        final int f;
        final long sequence;

        SearchNode(int index, int g, int f, long sequence) {
            this.index = index;
            this.g = g;
            this.f = f;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(SearchNode other) {
            int cmp = Integer.compare(this.f, other.f);
            if (cmp != 0) return cmp;
            cmp = Integer.compare(other.g, this.g); // prefer deeper
            if (cmp != 0) return cmp;
            return Long.compare(this.sequence, other.sequence);
        }
    }
}
