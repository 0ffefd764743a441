package org.gridsweep.runtime.controller;

import java.util.Map;

import org.gridsweep.runtime.coordination.CollisionAvoidance;
import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.planning.PathResult;

/**
 * Lets every agent decide only its next step, without any shared plan.
 * <p>
 * The preferred step is the first move of a fresh path to the agent's goal. If that step is
 * conflicted the personal-space heuristic picks an evasive move instead. Goals persist across
 * ticks until reached or invalid.
 */
public class DecentralizedController extends AbstractAgentController {

    public DecentralizedController(GridModel grid, Map<AgentKind, Position> startPositions,
                                   int garbageCapacity, ControllerServices services) {
        super(grid, startPositions, garbageCapacity, services);
    }

    @Override
    protected String strategyName() {
        return "Decentralized";
    }

    @Override
    protected Move chooseMove(Agent agent) {
        PathResult plan = services.planner().findPath(grid, agent.position(), agent.goal());
        if (!plan.success()) {
            abandonGoal(agent);
            return idleMove(agent);
        }
        Move preferred = plan.firstMove();
        CollisionAvoidance avoidance = services.avoidance();
        if (avoidance.isConflicted(agent, preferred, grid, agents())) {
            return avoidance.evade(agent, grid, agents(), services.random());
        }
        return preferred;
    }
}
