package org.gridsweep.runtime.model;

import java.util.Set;

/**
 * Base state and behaviour shared by all agent kinds.
 * <p>
 * An agent holds only its coordinates and its current goal. Subclasses supply the hazard
 * affinity, the clean-up effect and the priority used by collision avoidance.
 */
public abstract class Agent {
    private final AgentKind kind;
    private Position position;
    private Position goal;

    protected Agent(AgentKind kind, Position position) {
        this.kind = kind;
        this.position = position;
    }

    /**
     * Creates the agent implementation for a kind.
     *
     * @param kind The agent kind.
     * @param position The start position.
     * @param garbageCapacity Capacity used when {@code kind} is the garbage collector.
     * @return A fresh agent.
     */
    public static Agent create(AgentKind kind, Position position, int garbageCapacity) {
        return switch (kind) {
            case GARBAGE_COLLECTOR -> new GarbageCollector(position, garbageCapacity);
            case VACUUM -> new Vacuum(position);
            case MOP -> new Mop(position);
        };
    }

    public AgentKind kind() {
        return kind;
    }

    public Position position() {
        return position;
    }

    public void moveTo(Position position) {
        this.position = position;
    }

    /**
     * Returns the cell this agent currently targets.
     * @return The goal, or {@code null} when the agent is idle.
     */
    public Position goal() {
        return goal;
    }

    public boolean hasGoal() {
        return goal != null;
    }

    public void setGoal(Position goal) {
        this.goal = goal;
    }

    public void clearGoal() {
        this.goal = null;
    }

    /**
     * Returns the cell types this agent should head for given the current grid and its own state.
     *
     * @param grid The grid to inspect.
     * @return Target cell types, empty if the agent has nothing to do.
     */
    public abstract Set<Cell> targetCells(GridModel grid);

    /**
     * Cleans the cell the agent stands on.
     *
     * @param grid The grid to mutate.
     * @return Work units removed from the grid by this clean-up.
     */
    public int cleanUp(GridModel grid) {
        Cell before = grid.cleanUp(position, kind);
        return before.workUnits() - grid.cellAt(position).workUnits();
    }

    /**
     * Returns how much separation other agents can skip around this agent. Higher values
     * mark an agent that others treat as already far enough away.
     *
     * @return The priority bonus added to distances measured towards this agent.
     */
    public int priority() {
        return 0;
    }

    /**
     * Creates an independent copy for tick rollback.
     * @return A deep copy of this agent.
     */
    public abstract Agent copy();

    protected void copyBaseInto(Agent target) {
        target.position = this.position;
        target.goal = this.goal;
    }

    @Override
    public String toString() {
        return kind + " at " + position + (goal != null ? " -> " + goal : " (idle)");
    }
}
