package org.gridsweep.runtime.controller;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gridsweep.runtime.coordination.CollisionAvoidance;
import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tick orchestration shared by both strategies.
 * <p>
 * Each tick runs the following phases:
 * <ol>
 *   <li>Revalidate cached goals if the grid was edited from outside since the last tick.</li>
 *   <li>Step every agent in {@link AgentKind} order. A step refreshes the goal, asks the
 *   strategy for one move, applies it and cleans up on arrival. Later agents see the
 *   positions and grid changes of earlier ones.</li>
 *   <li>Check the post-tick invariants and report violations to the diagnostic sink.</li>
 * </ol>
 * A tick that throws is rolled back completely before a {@link ControllerFaultException}
 * is raised, so callers can keep reading (or retry from) the last committed state. The
 * rollback covers the grid, the agents and the tie-break random source, so a retried tick
 * draws the same numbers as the failed one.
 */
public abstract class AbstractAgentController implements IAgentController {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractAgentController.class);

    protected final GridModel grid;
    protected final ControllerServices services;
    private final Map<AgentKind, Agent> agents = new EnumMap<>(AgentKind.class);
    private final InvariantMonitor monitor = new InvariantMonitor();

    private long currentTick = 0L;
    private long seenEditVersion;
    private int pendingWork;
    private long lastTerminationReport = -1L;

    /**
     * Creates a controller for one run.
     *
     * @param grid The grid, owned by the controller from now on.
     * @param startPositions Start cell per agent kind; all kinds required, distinct and walkable.
     * @param garbageCapacity Capacity of the garbage collector.
     * @param services Collaborators used during ticks.
     */
    protected AbstractAgentController(GridModel grid, Map<AgentKind, Position> startPositions,
                                      int garbageCapacity, ControllerServices services) {
        this.grid = grid;
        this.services = services;
        Set<Position> taken = new HashSet<>();
        for (AgentKind kind : AgentKind.values()) {
            Position start = startPositions.get(kind);
            if (start == null) {
                throw new IllegalArgumentException("No start position for " + kind);
            }
            if (!grid.isWalkable(start)) {
                throw new IllegalArgumentException("Start position " + start + " of " + kind + " is not walkable.");
            }
            if (!taken.add(start)) {
                throw new IllegalArgumentException("Start position " + start + " of " + kind + " is already taken.");
            }
            agents.put(kind, Agent.create(kind, start, garbageCapacity));
        }
        this.seenEditVersion = grid.editVersion();
        this.pendingWork = scanWork();
    }

    /**
     * Returns the strategy name used in summaries.
     * @return A short name.
     */
    protected abstract String strategyName();

    /**
     * Decides the single move an agent with a goal makes this tick.
     *
     * @param agent The agent to move; its goal is set and differs from its position.
     * @return The move to apply. Must lead to a walkable, unoccupied cell or be {@link Move#STAY}.
     */
    protected abstract Move chooseMove(Agent agent);

    /**
     * Makes sure the agent has the goal it should pursue this tick. The default keeps a goal
     * until it is reached or becomes invalid, and selects a new one only when idle.
     *
     * @param agent The agent.
     */
    protected void refreshGoal(Agent agent) {
        if (!agent.hasGoal()) {
            services.goals().select(agent, grid).ifPresent(agent::setGoal);
        }
    }

    @Override
    public final void tick() {
        GridModel gridBefore = grid.copy();
        Map<AgentKind, Agent> agentsBefore = copyAgents();
        long editVersionBefore = seenEditVersion;
        int pendingWorkBefore = pendingWork;
        byte[] randomBefore = services.random().saveState();
        try {
            revalidateAfterEdits();
            for (Agent agent : agents.values()) {
                step(agent);
            }
        } catch (RuntimeException e) {
            grid.restoreFrom(gridBefore);
            agents.putAll(agentsBefore);
            seenEditVersion = editVersionBefore;
            pendingWork = pendingWorkBefore;
            services.random().loadState(randomBefore);
            onRollback();
            throw new ControllerFaultException(currentTick + 1, describe(), e);
        }
        currentTick++;
        for (InvariantViolation violation : monitor.check(currentTick, agents.values())) {
            report(violation);
        }
    }

    /**
     * Hook for strategies that keep per-tick state of their own. Called after the grid and
     * agents were restored.
     */
    protected void onRollback() {
    }

    private void step(Agent agent) {
        if (agent instanceof GarbageCollector collector && collector.updateMode(grid)) {
            agent.clearGoal();
            LOG.debug("{} switches to {}", agent.kind(), collector.mode());
        }
        if (agent.hasGoal() && !services.goals().isGoalValid(agent, grid)) {
            LOG.debug("{} drops stale goal {}", agent.kind(), agent.goal());
            agent.clearGoal();
        }
        refreshGoal(agent);

        if (agent.hasGoal() && agent.position().equals(agent.goal())) {
            arrive(agent);
            return;
        }
        Move move = agent.hasGoal() ? chooseMove(agent) : idleMove(agent);
        apply(agent, move);
        if (agent.hasGoal() && agent.position().equals(agent.goal())) {
            arrive(agent);
        }
    }

    /**
     * Move for an agent without a goal: evade unless already comfortably far from everybody.
     *
     * @param agent The idle agent.
     * @return The evasive move, or {@link Move#STAY}.
     */
    protected Move idleMove(Agent agent) {
        CollisionAvoidance avoidance = services.avoidance();
        if (avoidance.isComfortable(agent, agents.values())) {
            return Move.STAY;
        }
        return avoidance.evade(agent, grid, agents.values(), services.random());
    }

    /**
     * Clears the goal of an agent whose goal cannot be reached. It is selected again next tick.
     *
     * @param agent The agent.
     */
    protected void abandonGoal(Agent agent) {
        LOG.debug("{} at {} cannot reach {}, goal cleared", agent.kind(), agent.position(), agent.goal());
        agent.clearGoal();
    }

    private void apply(Agent agent, Move move) {
        if (move == Move.STAY) {
            return;
        }
        Position target = agent.position().apply(move);
        if (!grid.isWalkable(target)) {
            throw new IllegalStateException(agent.kind() + " tried to move onto non-walkable cell " + target);
        }
        if (CollisionAvoidance.isOccupied(agent, target, agents.values())) {
            throw new IllegalStateException(agent.kind() + " tried to move onto occupied cell " + target);
        }
        agent.moveTo(target);
    }

    private void arrive(Agent agent) {
        Cell before = grid.cellAt(agent.position());
        int removed = agent.cleanUp(grid);
        pendingWork -= removed;
        LOG.debug("{} reached {} ({} -> {}, {} work units left)",
                agent.kind(), agent.position(), before, grid.cellAt(agent.position()), pendingWork);
        agent.clearGoal();
    }

    private void revalidateAfterEdits() {
        if (grid.editVersion() == seenEditVersion) {
            return;
        }
        for (Agent agent : agents.values()) {
            if (agent.hasGoal() && !services.goals().isGoalValid(agent, grid)) {
                LOG.debug("{} goal {} invalidated by grid edit", agent.kind(), agent.goal());
                agent.clearGoal();
            }
        }
        pendingWork = scanWork();
        seenEditVersion = grid.editVersion();
    }

    /**
     * Sums the work units on the grid by visiting every cell, independent of the type index.
     * @return Remaining work units.
     */
    private int scanWork() {
        int[] total = new int[1];
        grid.forEachIndex(index -> total[0] += grid.cellAtIndex(index).workUnits());
        return total[0];
    }

    @Override
    public boolean finished() {
        int scanned = scanWork();
        if (grid.editVersion() == seenEditVersion && scanned != pendingWork
                && lastTerminationReport != currentTick) {
            lastTerminationReport = currentTick;
            report(new InvariantViolation(InvariantViolation.Type.TERMINATION, currentTick,
                    "bookkeeping expects " + pendingWork + " work units, grid scan finds " + scanned));
        }
        if (scanned != 0) {
            return false;
        }
        for (Agent agent : agents.values()) {
            if (agent.hasGoal()) {
                return false;
            }
            if (agent instanceof GarbageCollector collector && collector.load() > 0) {
                return false;
            }
        }
        return true;
    }

    private void report(InvariantViolation violation) {
        try {
            services.sink().log(violation.describe());
        } catch (RuntimeException e) {
            LOG.warn("Diagnostic sink failed to record {}: {}", violation.type(), e.getMessage());
        }
    }

    @Override
    public Map<AgentKind, Position> agentLocations() {
        Map<AgentKind, Position> locations = new EnumMap<>(AgentKind.class);
        for (Agent agent : agents.values()) {
            locations.put(agent.kind(), agent.position());
        }
        return Collections.unmodifiableMap(locations);
    }

    /**
     * Returns the live agent of a kind. Intended for inspection between ticks.
     * @param kind The agent kind.
     * @return The agent.
     */
    public Agent agent(AgentKind kind) {
        return agents.get(kind);
    }

    /**
     * Returns all live agents in stepping order.
     * @return An unmodifiable view.
     */
    protected Collection<Agent> agents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    /**
     * Collects the cells occupied by agents other than {@code self}.
     * @param self The agent to exclude.
     * @return Occupied positions.
     */
    protected Set<Position> occupiedByOthers(Agent self) {
        Set<Position> occupied = new HashSet<>();
        for (Agent other : agents.values()) {
            if (other != self) {
                occupied.add(other.position());
            }
        }
        return occupied;
    }

    public GridModel grid() {
        return grid;
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * Returns the work units the controller believes are left.
     * @return Pending work units.
     */
    public int pendingWork() {
        return pendingWork;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(strategyName()).append(" controller, tick ").append(currentTick)
                .append(", ").append(pendingWork).append(" work units pending\n");
        for (Agent agent : agents.values()) {
            sb.append("  ").append(agent).append('\n');
        }
        List<char[]> rows = new ArrayList<>(grid.rows());
        for (String line : grid.render().split("\n")) {
            rows.add(line.toCharArray());
        }
        for (Agent agent : agents.values()) {
            Position pos = agent.position();
            rows.get(pos.row())[pos.col()] = agent.kind().symbol();
        }
        for (char[] row : rows) {
            sb.append(row).append('\n');
        }
        return sb.toString();
    }

    private Map<AgentKind, Agent> copyAgents() {
        Map<AgentKind, Agent> copies = new EnumMap<>(AgentKind.class);
        for (Map.Entry<AgentKind, Agent> entry : agents.entrySet()) {
            copies.put(entry.getKey(), entry.getValue().copy());
        }
        return copies;
    }
}
