package org.gridsweep.runtime.controller;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.planning.PathResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans a complete path for every agent on every tick and advances each agent one step.
 * <p>
 * Goals are re-evaluated each tick, but a new goal only replaces the current one when it is
 * strictly closer, which rules out oscillation between equally good targets. A garbage
 * collector returning to a bin is committed to that trip and never re-evaluates.
 * <p>
 * When the next planned cell is occupied, the path is planned again around all occupied
 * cells. If no such path exists the agent evades.
 */
public class CentralizedController extends AbstractAgentController {
    private static final Logger LOG = LoggerFactory.getLogger(CentralizedController.class);

    private final Map<AgentKind, List<Move>> plans = new EnumMap<>(AgentKind.class);

    public CentralizedController(GridModel grid, Map<AgentKind, Position> startPositions,
                                 int garbageCapacity, ControllerServices services) {
        super(grid, startPositions, garbageCapacity, services);
    }

    @Override
    protected String strategyName() {
        return "Centralized";
    }

    @Override
    protected void refreshGoal(Agent agent) {
        if (agent.hasGoal() && isCommitted(agent)) {
            return;
        }
        Optional<Position> candidate = services.goals().select(agent, grid);
        if (candidate.isEmpty()) {
            return;
        }
        Position next = candidate.get();
        if (!agent.hasGoal()) {
            agent.setGoal(next);
        } else if (!next.equals(agent.goal())
                && agent.position().manhattanDistance(next) < agent.position().manhattanDistance(agent.goal())) {
            LOG.debug("{} switches goal {} -> {}", agent.kind(), agent.goal(), next);
            agent.setGoal(next);
        }
    }

    private static boolean isCommitted(Agent agent) {
        return agent instanceof GarbageCollector collector
                && collector.mode() == GarbageCollector.Mode.RETURNING_TO_BIN;
    }

    @Override
    protected Move chooseMove(Agent agent) {
        PathResult plan = services.planner().findPath(grid, agent.position(), agent.goal());
        if (!plan.success()) {
            plans.remove(agent.kind());
            abandonGoal(agent);
            return idleMove(agent);
        }
        Move next = plan.firstMove();
        if (occupiedByOthers(agent).contains(agent.position().apply(next))) {
            PathResult detour = services.planner().findPath(grid, agent.position(), agent.goal(),
                    occupiedByOthers(agent));
            if (!detour.success() || detour.moves().isEmpty()
                    || occupiedByOthers(agent).contains(agent.position().apply(detour.firstMove()))) {
                // the evasive step leaves the plan, so nothing is left to follow
                plans.put(agent.kind(), List.of());
                return services.avoidance().evade(agent, grid, agents(), services.random());
            }
            plan = detour;
            next = plan.firstMove();
        }
        plans.put(agent.kind(), plan.moves().subList(1, plan.moves().size()));
        return next;
    }

    @Override
    protected void onRollback() {
        plans.clear();
    }

    /**
     * Returns the moves an agent still has planned after its last step.
     * @param kind The agent kind.
     * @return The remaining plan, empty if none.
     */
    public List<Move> plannedMoves(AgentKind kind) {
        return plans.getOrDefault(kind, List.of());
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(super.describe());
        for (Map.Entry<AgentKind, List<Move>> entry : plans.entrySet()) {
            sb.append("  plan ").append(entry.getKey()).append(": ").append(entry.getValue().size())
                    .append(" moves left\n");
        }
        return sb.toString();
    }
}
