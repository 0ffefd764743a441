package org.gridsweep.runtime.coordination;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Personal-space heuristic that keeps agents apart.
 * <p>
 * The separation score of a position is the minimum, over all other agents, of the Manhattan
 * distance to that agent plus the agent's {@link Agent#priority()}. A high-priority agent (a
 * garbage collector with a full load) therefore counts as further away than it is, so others
 * owe it less room and keep their own course.
 * <p>
 * Candidate moves are staying put and the four unit moves onto walkable cells that no other
 * agent currently occupies. Positions are read live, so an agent stepped later in a tick sees
 * where earlier agents already moved.
 */
public class CollisionAvoidance {
    private static final Logger LOG = LoggerFactory.getLogger(CollisionAvoidance.class);

    private final int comfortableSeparation;

    /**
     * Creates the heuristic.
     *
     * @param comfortableSeparation Separation score above which an agent does not evade.
     */
    public CollisionAvoidance(int comfortableSeparation) {
        if (comfortableSeparation < 0) {
            throw new IllegalArgumentException("comfortable-separation must be >= 0, got " + comfortableSeparation);
        }
        this.comfortableSeparation = comfortableSeparation;
    }

    public int comfortableSeparation() {
        return comfortableSeparation;
    }

    /**
     * Computes the separation score of {@code self} if it stood at {@code at}.
     *
     * @param self The agent being scored; excluded from the comparison.
     * @param at The hypothetical position.
     * @param agents All agents of the run.
     * @return The separation score, {@link Integer#MAX_VALUE} if there are no other agents.
     */
    public int separation(Agent self, Position at, Collection<Agent> agents) {
        int min = Integer.MAX_VALUE;
        for (Agent other : agents) {
            if (other == self) continue;
            min = Math.min(min, at.manhattanDistance(other.position()) + other.priority());
        }
        return min;
    }

    /**
     * Checks whether the agent is already far enough from everybody to ignore them.
     *
     * @param self The agent.
     * @param agents All agents of the run.
     * @return true if the current separation exceeds the comfortable threshold.
     */
    public boolean isComfortable(Agent self, Collection<Agent> agents) {
        return separation(self, self.position(), agents) > comfortableSeparation;
    }

    /**
     * Checks whether the preferred move would run into another agent or off the walkable grid.
     *
     * @param self The agent.
     * @param preferred The move the agent would like to make.
     * @param grid The grid.
     * @param agents All agents of the run.
     * @return true if the move cannot be made as is.
     */
    public boolean isConflicted(Agent self, Move preferred, GridModel grid, Collection<Agent> agents) {
        if (preferred == Move.STAY) {
            return false;
        }
        Position target = self.position().apply(preferred);
        return !grid.isWalkable(target) || isOccupied(self, target, agents);
    }

    /**
     * Lists the moves the agent may make this tick. {@link Move#STAY} is always included.
     *
     * @param self The agent.
     * @param grid The grid.
     * @param agents All agents of the run.
     * @return Allowed moves in {@link Move#CANDIDATES} order.
     */
    public List<Move> candidateMoves(Agent self, GridModel grid, Collection<Agent> agents) {
        List<Move> moves = new ArrayList<>(Move.CANDIDATES.size());
        for (Move move : Move.CANDIDATES) {
            if (move == Move.STAY) {
                moves.add(move);
                continue;
            }
            Position target = self.position().apply(move);
            if (grid.isWalkable(target) && !isOccupied(self, target, agents)) {
                moves.add(move);
            }
        }
        return moves;
    }

    /**
     * Chooses the candidate move that maximises the separation score. Ties are broken
     * uniformly at random.
     *
     * @param self The agent.
     * @param grid The grid.
     * @param agents All agents of the run.
     * @param random Source of randomness for tie-breaking.
     * @return The evasive move.
     */
    public Move evade(Agent self, GridModel grid, Collection<Agent> agents, IRandomProvider random) {
        List<Move> best = new ArrayList<>();
        int bestScore = Integer.MIN_VALUE;
        for (Move move : candidateMoves(self, grid, agents)) {
            int score = separation(self, self.position().apply(move), agents);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(move);
            } else if (score == bestScore) {
                best.add(move);
            }
        }
        Move chosen = best.size() == 1 ? best.get(0) : best.get(random.nextInt(best.size()));
        LOG.debug("{} evades with {} (separation {}, {} tied)", self.kind(), chosen, bestScore, best.size());
        return chosen;
    }

    /**
     * Checks whether another agent stands on a position.
     *
     * @param self The asking agent, ignored.
     * @param pos The position.
     * @param agents All agents of the run.
     * @return true if some other agent occupies the position.
     */
    public static boolean isOccupied(Agent self, Position pos, Collection<Agent> agents) {
        for (Agent other : agents) {
            if (other != self && other.position().equals(pos)) {
                return true;
            }
        }
        return false;
    }
}
