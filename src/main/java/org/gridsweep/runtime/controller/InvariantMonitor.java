package org.gridsweep.runtime.controller;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.Position;

/**
 * Checks the post-tick invariants on the agents of a run.
 */
public class InvariantMonitor {

    /**
     * Inspects agents after a committed tick.
     *
     * @param tick The tick just committed.
     * @param agents All agents of the run.
     * @return The violations found, empty when everything is consistent.
     */
    public List<InvariantViolation> check(long tick, Collection<Agent> agents) {
        List<InvariantViolation> violations = new ArrayList<>();
        Map<Position, Agent> occupied = new HashMap<>();
        for (Agent agent : agents) {
            Agent previous = occupied.putIfAbsent(agent.position(), agent);
            if (previous != null) {
                violations.add(new InvariantViolation(InvariantViolation.Type.COLLISION, tick,
                        previous.kind() + " and " + agent.kind() + " both occupy " + agent.position()));
            }
            if (agent instanceof GarbageCollector collector) {
                checkLoad(tick, collector, violations);
            }
        }
        return violations;
    }

    private static void checkLoad(long tick, GarbageCollector collector, List<InvariantViolation> violations) {
        if (collector.load() > collector.capacity()) {
            violations.add(new InvariantViolation(InvariantViolation.Type.OVERFLOW, tick,
                    "load " + collector.load() + " exceeds capacity " + collector.capacity()));
        } else if (collector.isFull() && collector.mode() != GarbageCollector.Mode.RETURNING_TO_BIN) {
            violations.add(new InvariantViolation(InvariantViolation.Type.OVERFLOW, tick,
                    "full load " + collector.load() + " without a bin trip (mode " + collector.mode() + ")"));
        }
    }
}
