package org.gridsweep.runtime.controller;

/**
 * A correctness defect detected after a tick.
 *
 * @param type What was violated.
 * @param tick The tick after which the defect was seen.
 * @param detail Human-readable details.
 */
public record InvariantViolation(Type type, long tick, String detail) {

    /**
     * Kinds of invariant a controller must uphold.
     */
    public enum Type {
        /** Two agents share a cell. */
        COLLISION,
        /** The garbage collector exceeds its capacity or keeps collecting while full. */
        OVERFLOW,
        /** Work bookkeeping disagrees with the grid. */
        TERMINATION
    }

    /**
     * Formats the violation for a diagnostic sink.
     * @return A single-line message.
     */
    public String describe() {
        return type + " violation after tick " + tick + ": " + detail;
    }
}
