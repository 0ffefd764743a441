package org.gridsweep.runtime.controller;

import org.gridsweep.runtime.coordination.CollisionAvoidance;
import org.gridsweep.runtime.goals.GoalSelector;
import org.gridsweep.runtime.internal.services.Slf4jDiagnosticSink;
import org.gridsweep.runtime.planning.AStarPathPlanner;
import org.gridsweep.runtime.planning.IPathPlanner;
import org.gridsweep.runtime.spi.IDiagnosticSink;
import org.gridsweep.runtime.spi.IRandomProvider;

/**
 * Collaborators a controller delegates to.
 *
 * @param goals Goal selection.
 * @param planner Path planning.
 * @param avoidance Personal-space heuristic.
 * @param random Tie-break randomness for evasion.
 * @param sink Receives invariant violations.
 */
public record ControllerServices(
        GoalSelector goals,
        IPathPlanner planner,
        CollisionAvoidance avoidance,
        IRandomProvider random,
        IDiagnosticSink sink) {

    /** Default slack for comparably distant hazards. */
    public static final int DEFAULT_COMPARABLE_SLACK = 2;
    /** Default weight of the hull depth term. */
    public static final double DEFAULT_HULL_WEIGHT = 1.0;
    /** Default comfortable separation. */
    public static final int DEFAULT_COMFORTABLE_SEPARATION = 6;

    /**
     * Creates the default collaborators around a random source.
     * @param random Tie-break randomness.
     * @return Services with default tuning and an SLF4J sink.
     */
    public static ControllerServices defaults(IRandomProvider random) {
        return new ControllerServices(
                new GoalSelector(DEFAULT_COMPARABLE_SLACK, DEFAULT_HULL_WEIGHT),
                new AStarPathPlanner(),
                new CollisionAvoidance(DEFAULT_COMFORTABLE_SEPARATION),
                random,
                new Slf4jDiagnosticSink());
    }

    /**
     * Returns a copy reporting to another sink.
     * @param other The sink to use.
     * @return The adjusted services.
     */
    public ControllerServices withSink(IDiagnosticSink other) {
        return new ControllerServices(goals, planner, avoidance, random, other);
    }
}
