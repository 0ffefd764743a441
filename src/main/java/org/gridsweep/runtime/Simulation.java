package org.gridsweep.runtime;

import org.gridsweep.runtime.controller.ControllerFaultException;
import org.gridsweep.runtime.controller.IAgentController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a controller tick by tick until the run finishes, the watchdog fires or a tick faults.
 * <p>
 * The driver never lets a controller fault escape: a failed tick pauses the run with status
 * {@link Status#FAULTED} and keeps the fault for inspection. The controller still holds the
 * last committed state.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    /**
     * Lifecycle of a run.
     */
    public enum Status {
        RUNNING,
        FINISHED,
        ABORTED,
        FAULTED
    }

    /**
     * Outcome of a run.
     *
     * @param status Final status.
     * @param ticks Committed ticks.
     * @param seed Seed the run was built from.
     * @param summary Controller summary at the end of the run.
     */
    public record RunResult(Status status, long ticks, long seed, String summary) {
    }

    private final IAgentController controller;
    private final long maxTicks;
    private final long seed;
    private long currentTick = 0L;
    private Status status = Status.RUNNING;
    private ControllerFaultException lastFault;
    /**
     * A flag to pause or resume the simulation.
     */
    public boolean paused = false;

    /**
     * Creates a driver.
     *
     * @param controller The controller to drive.
     * @param maxTicks Watchdog limit; the run is aborted once this many ticks were committed.
     * @param seed Seed the run was built from, reported in the result.
     */
    public Simulation(IAgentController controller, long maxTicks, long seed) {
        if (maxTicks <= 0) {
            throw new IllegalArgumentException("maxTicks must be positive, got " + maxTicks);
        }
        this.controller = controller;
        this.maxTicks = maxTicks;
        this.seed = seed;
    }

    /**
     * Computes the watchdog limit for a grid.
     *
     * @param rows Grid rows.
     * @param cols Grid columns.
     * @param ticksPerCell Ticks granted per grid cell.
     * @param minTicks Lower bound for small grids.
     * @return {@code max(minTicks, ticksPerCell * rows * cols)}.
     */
    public static long watchdogLimit(int rows, int cols, int ticksPerCell, long minTicks) {
        return Math.max(minTicks, (long) ticksPerCell * rows * cols);
    }

    /**
     * Advances the run by one tick.
     *
     * @return true if a tick was committed and the run is still going.
     */
    public boolean tick() {
        if (status != Status.RUNNING || paused) {
            return false;
        }
        if (controller.finished()) {
            finish();
            return false;
        }
        if (currentTick >= maxTicks) {
            status = Status.ABORTED;
            LOG.warn("Watchdog aborted the run after {} ticks without finishing (seed {}):\n{}",
                    currentTick, seed, controller.describe());
            return false;
        }
        try {
            controller.tick();
        } catch (ControllerFaultException e) {
            status = Status.FAULTED;
            paused = true;
            lastFault = e;
            LOG.error("Run paused, tick {} faulted (seed {}). Last committed state:\n{}",
                    e.getTick(), seed, e.getStateSummary(), e);
            return false;
        }
        currentTick++;
        if (controller.finished()) {
            finish();
            return false;
        }
        return true;
    }

    private void finish() {
        status = Status.FINISHED;
        LOG.info("Run finished after {} ticks (seed {})", currentTick, seed);
    }

    /**
     * Ticks until the run leaves {@link Status#RUNNING} or is paused.
     * @return The outcome.
     */
    public RunResult runToCompletion() {
        while (tick()) {
            // keep ticking
        }
        return result();
    }

    /**
     * Returns the outcome so far.
     * @return The current result.
     */
    public RunResult result() {
        return new RunResult(status, currentTick, seed, controller.describe());
    }

    public IAgentController getController() {
        return controller;
    }

    public Status getStatus() {
        return status;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public long getMaxTicks() {
        return maxTicks;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Returns the fault that paused the run.
     * @return The fault, or {@code null} if the run never faulted.
     */
    public ControllerFaultException getLastFault() {
        return lastFault;
    }
}
