package org.gridsweep.runtime.controller;

import java.util.Map;

import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;

/**
 * The available coordination strategies.
 */
public enum Strategy {
    CENTRALIZED,
    DECENTRALIZED;

    /**
     * Creates a controller of this strategy.
     *
     * @param grid The grid of the run.
     * @param startPositions Start cell per agent kind.
     * @param garbageCapacity Capacity of the garbage collector.
     * @param services Collaborators.
     * @return A new controller.
     */
    public AbstractAgentController create(GridModel grid, Map<AgentKind, Position> startPositions,
                                          int garbageCapacity, ControllerServices services) {
        return switch (this) {
            case CENTRALIZED -> new CentralizedController(grid, startPositions, garbageCapacity, services);
            case DECENTRALIZED -> new DecentralizedController(grid, startPositions, garbageCapacity, services);
        };
    }
}
