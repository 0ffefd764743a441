package org.gridsweep.runtime.controller;

/**
 * Thrown when a tick fails unexpectedly. The controller has already rolled back to the
 * last committed state when this is raised.
 */
public class ControllerFaultException extends RuntimeException {

    private final long tick;
    private final String stateSummary;

    /**
     * Creates a new fault.
     *
     * @param tick The tick that failed.
     * @param stateSummary Summary of the restored state.
     * @param cause The underlying failure.
     */
    public ControllerFaultException(long tick, String stateSummary, Throwable cause) {
        super("Tick " + tick + " failed: " + cause, cause);
        this.tick = tick;
        this.stateSummary = stateSummary;
    }

    public long getTick() {
        return tick;
    }

    public String getStateSummary() {
        return stateSummary;
    }
}
