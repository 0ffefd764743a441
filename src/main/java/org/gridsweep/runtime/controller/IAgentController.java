package org.gridsweep.runtime.controller;

import java.util.Map;

import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.Position;

/**
 * Contract shared by all coordination strategies.
 * <p>
 * A controller exclusively owns the grid and the agents of one run. Callers may read state
 * and edit the grid between ticks, never during one.
 */
public interface IAgentController {

    /**
     * Advances the run by one step. Either the whole step is committed or, on failure,
     * nothing is.
     *
     * @throws ControllerFaultException if the step failed; the last committed state stays intact.
     */
    void tick();

    /**
     * Returns where each agent currently stands.
     * @return An unmodifiable snapshot keyed by agent kind.
     */
    Map<AgentKind, Position> agentLocations();

    /**
     * Checks whether all work is done. Calling this repeatedly between ticks always
     * yields the same answer.
     *
     * @return true if the grid holds no hazard, no agent has a goal and nothing is carried.
     */
    boolean finished();

    /**
     * Returns a human-readable summary of the run state.
     * @return A multi-line description.
     */
    String describe();
}
