package org.gridsweep.runtime;

import java.util.Map;

import org.gridsweep.runtime.controller.ControllerServices;
import org.gridsweep.runtime.controller.IAgentController;
import org.gridsweep.runtime.coordination.CollisionAvoidance;
import org.gridsweep.runtime.goals.GoalSelector;
import org.gridsweep.runtime.internal.services.SeededRandomProvider;
import org.gridsweep.runtime.internal.services.Slf4jDiagnosticSink;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.planning.AStarPathPlanner;
import org.gridsweep.runtime.spi.IDiagnosticSink;
import org.gridsweep.runtime.spi.IStartPositionProvider;
import org.gridsweep.runtime.worldgen.FixedStartPositions;
import org.gridsweep.runtime.worldgen.RandomGridGenerator;
import org.gridsweep.runtime.worldgen.RandomizedStartPositions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a ready-to-run {@link Simulation} from settings.
 * <p>
 * All randomness derives from the run seed: grid generation, start positions and
 * collision tie-breaks each get their own sub-stream.
 */
public final class SimulationFactory {
    private static final Logger LOG = LoggerFactory.getLogger(SimulationFactory.class);

    private SimulationFactory() {
    }

    /**
     * Builds a run with a generated grid.
     * @param settings The settings.
     * @return The simulation.
     */
    public static Simulation create(SimulationSettings settings) {
        return create(settings, new Slf4jDiagnosticSink());
    }

    /**
     * Builds a run with a generated grid and a custom diagnostic sink.
     *
     * @param settings The settings.
     * @param sink Receives invariant violations.
     * @return The simulation.
     */
    public static Simulation create(SimulationSettings settings, IDiagnosticSink sink) {
        long seed = settings.seed() != null ? settings.seed() : System.nanoTime();
        SeededRandomProvider random = new SeededRandomProvider(seed);
        GridModel grid = new RandomGridGenerator(random.deriveFor("worldgen", 0)).generate(settings.grid());
        IStartPositionProvider starts = settings.randomizeStarts()
                ? new RandomizedStartPositions(random.deriveFor("starts", 0))
                : new FixedStartPositions();
        return create(settings, seed, grid, starts, sink);
    }

    /**
     * Builds a run on a given grid.
     *
     * @param settings The settings; grid generation parameters are ignored.
     * @param seed The run seed.
     * @param grid The grid to run on.
     * @param starts Start position provider.
     * @param sink Receives invariant violations.
     * @return The simulation.
     */
    public static Simulation create(SimulationSettings settings, long seed, GridModel grid,
                                    IStartPositionProvider starts, IDiagnosticSink sink) {
        SeededRandomProvider random = new SeededRandomProvider(seed);
        ControllerServices services = new ControllerServices(
                new GoalSelector(settings.comparableSlack(), settings.hullWeight()),
                new AStarPathPlanner(),
                new CollisionAvoidance(settings.comfortableSeparation()),
                random.deriveFor("avoidance", 0),
                sink);
        Map<AgentKind, Position> startPositions = starts.startPositions(grid);
        IAgentController controller = settings.strategy()
                .create(grid, startPositions, settings.garbageCapacity(), services);
        long maxTicks = settings.maxTicks() > 0
                ? settings.maxTicks()
                : Simulation.watchdogLimit(grid.rows(), grid.cols(), settings.ticksPerCell(), settings.minTicks());
        LOG.debug("Created {} run on {}x{} grid, seed {}, watchdog {} ticks, starts {}",
                settings.strategy(), grid.rows(), grid.cols(), seed, maxTicks, startPositions);
        return new Simulation(controller, maxTicks, seed);
    }
}
