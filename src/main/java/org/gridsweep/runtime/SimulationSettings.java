package org.gridsweep.runtime;

import org.gridsweep.runtime.controller.Strategy;
import org.gridsweep.runtime.spi.GridSpec;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code simulation} configuration block.
 *
 * @param grid Grid generation parameters.
 * @param garbageCapacity Capacity of the garbage collector.
 * @param randomizeStarts Whether agents start on random cells instead of the corners.
 * @param comparableSlack Goal selection slack.
 * @param hullWeight Goal selection hull weight.
 * @param comfortableSeparation Collision avoidance threshold.
 * @param ticksPerCell Watchdog ticks per grid cell.
 * @param minTicks Watchdog lower bound.
 * @param maxTicks Explicit watchdog limit, 0 to derive it from the grid size.
 * @param strategy Coordination strategy.
 * @param seed Run seed, {@code null} to pick one at random.
 */
public record SimulationSettings(
        GridSpec grid,
        int garbageCapacity,
        boolean randomizeStarts,
        int comparableSlack,
        double hullWeight,
        int comfortableSeparation,
        int ticksPerCell,
        long minTicks,
        long maxTicks,
        Strategy strategy,
        Long seed) {

    public SimulationSettings {
        if (garbageCapacity <= 0) {
            throw new IllegalArgumentException("agents.garbage-capacity must be positive, got " + garbageCapacity);
        }
        if (ticksPerCell <= 0 || minTicks <= 0) {
            throw new IllegalArgumentException("watchdog.ticks-per-cell and watchdog.min-ticks must be positive");
        }
        if (maxTicks < 0) {
            throw new IllegalArgumentException("watchdog.max-ticks must be >= 0, got " + maxTicks);
        }
    }

    /**
     * Reads settings from the {@code simulation} block.
     *
     * @param config The {@code simulation} block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static SimulationSettings fromConfig(Config config) {
        Config agents = config.getConfig("agents");
        Config goals = config.getConfig("goals");
        Config watchdog = config.getConfig("watchdog");
        return new SimulationSettings(
                GridSpec.fromConfig(config.getConfig("grid")),
                agents.getInt("garbage-capacity"),
                agents.getBoolean("randomize-starts"),
                goals.getInt("comparable-slack"),
                goals.getDouble("hull-weight"),
                config.getInt("avoidance.comfortable-separation"),
                watchdog.getInt("ticks-per-cell"),
                watchdog.getLong("min-ticks"),
                watchdog.hasPath("max-ticks") ? watchdog.getLong("max-ticks") : 0L,
                config.getEnum(Strategy.class, "strategy"),
                config.hasPath("seed") ? config.getLong("seed") : null);
    }
}
