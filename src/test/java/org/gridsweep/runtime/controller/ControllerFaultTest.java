package org.gridsweep.runtime.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.gridsweep.junit.extensions.logging.ExpectLog;
import org.gridsweep.junit.extensions.logging.LogLevel;
import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.gridsweep.runtime.Simulation;
import org.gridsweep.runtime.coordination.CollisionAvoidance;
import org.gridsweep.runtime.goals.GoalSelector;
import org.gridsweep.runtime.internal.services.SeededRandomProvider;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.planning.AStarPathPlanner;
import org.gridsweep.runtime.planning.IPathPlanner;
import org.gridsweep.runtime.spi.IDiagnosticSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tick rollback, fault surfacing and termination cross-checks.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class ControllerFaultTest {

    private static final Map<AgentKind, Position> STARTS = Map.of(
            AgentKind.GARBAGE_COLLECTOR, Position.of(0, 0),
            AgentKind.VACUUM, Position.of(2, 2),
            AgentKind.MOP, Position.of(2, 0));

    @Mock
    private IPathPlanner planner;

    @Mock
    private IDiagnosticSink sink;

    private GridModel grid;

    @BeforeEach
    void setUp() {
        grid = GridModel.parse(
                "t . .",
                ". . .",
                ". . B");
    }

    private AbstractAgentController controller(IPathPlanner pathPlanner) {
        ControllerServices services = new ControllerServices(new GoalSelector(2, 1.0), pathPlanner,
                new CollisionAvoidance(6), new SeededRandomProvider(1L), sink);
        return Strategy.DECENTRALIZED.create(grid, STARTS, 5, services);
    }

    @Test
    void failedTickRollsBackEverything() {
        AStarPathPlanner real = new AStarPathPlanner();
        when(planner.findPath(any(GridModel.class), any(Position.class), any(Position.class)))
                .thenThrow(new IllegalStateException("boom"))
                .thenAnswer(inv -> real.findPath(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        AbstractAgentController controller = controller(planner);
        String before = grid.render();

        // the collector bags its cell, then the vacuum's planning call fails
        assertThatThrownBy(controller::tick)
                .isInstanceOf(ControllerFaultException.class)
                .hasRootCauseMessage("boom")
                .satisfies(e -> assertThat(((ControllerFaultException) e).getTick()).isEqualTo(1));

        assertThat(grid.render()).isEqualTo(before);
        assertThat(((GarbageCollector) controller.agent(AgentKind.GARBAGE_COLLECTOR)).load()).isZero();
        assertThat(controller.agent(AgentKind.VACUUM).goal()).isNull();
        assertThat(controller.agentLocations()).isEqualTo(STARTS);
        assertThat(controller.getCurrentTick()).isZero();
        assertThat(controller.pendingWork()).isEqualTo(2);

        controller.tick();

        assertThat(controller.getCurrentTick()).isEqualTo(1);
        assertThat(grid.cellAt(Position.of(0, 0))).isEqualTo(Cell.DUSTY);
        verify(sink, never()).log(anyString());
    }

    @Test
    void failedTickRestoresTheRandomSource() {
        SeededRandomProvider random = new SeededRandomProvider(1L);
        when(planner.findPath(any(GridModel.class), any(Position.class), any(Position.class)))
                .thenAnswer(inv -> {
                    random.nextInt(100);
                    random.nextDouble();
                    throw new IllegalStateException("boom");
                });
        ControllerServices services = new ControllerServices(new GoalSelector(2, 1.0), planner,
                new CollisionAvoidance(6), random, sink);
        AbstractAgentController controller = Strategy.DECENTRALIZED.create(grid, STARTS, 5, services);

        assertThatThrownBy(controller::tick).isInstanceOf(ControllerFaultException.class);

        SeededRandomProvider untouched = new SeededRandomProvider(1L);
        assertThat(random.nextInt(1000)).isEqualTo(untouched.nextInt(1000));
        assertThat(random.nextDouble()).isEqualTo(untouched.nextDouble());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Simulation", messagePattern = "Run paused, tick 1 faulted.*")
    void simulationPausesOnFault() {
        when(planner.findPath(any(GridModel.class), any(Position.class), any(Position.class)))
                .thenThrow(new IllegalStateException("boom"));
        AbstractAgentController controller = controller(planner);
        Simulation simulation = new Simulation(controller, 100, 1L);

        Simulation.RunResult result = simulation.runToCompletion();

        assertThat(result.status()).isEqualTo(Simulation.Status.FAULTED);
        assertThat(result.ticks()).isZero();
        assertThat(simulation.paused).isTrue();
        assertThat(simulation.getLastFault().getStateSummary()).contains("Decentralized controller, tick 0");
        assertThat(simulation.tick()).isFalse();
        assertThat(grid.cellAt(Position.of(0, 0))).isEqualTo(Cell.DRY_TRASH);
    }

    @Test
    void bookkeepingMismatchIsReportedOncePerTick() {
        AbstractAgentController controller = controller(new AStarPathPlanner());

        // a change that bypasses paint() is invisible to the edit tracking
        grid.cleanUp(Position.of(0, 0), AgentKind.GARBAGE_COLLECTOR);

        assertThat(controller.finished()).isFalse();
        assertThat(controller.finished()).isFalse();
        verify(sink, times(1)).log(startsWith("TERMINATION violation after tick 0"));
    }

    @Test
    void paintedEditsAreNotMistakenForBookkeepingDefects() {
        AbstractAgentController controller = controller(new AStarPathPlanner());

        grid.paint(Position.of(0, 0), Cell.EMPTY);

        assertThat(controller.finished()).isTrue();
        verify(sink, never()).log(anyString());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Diagnostic sink failed to record TERMINATION.*")
    void failingSinkDoesNotBreakTheRun() {
        doThrow(new IllegalStateException("sink down")).when(sink).log(anyString());
        AbstractAgentController controller = controller(new AStarPathPlanner());
        grid.cleanUp(Position.of(0, 0), AgentKind.GARBAGE_COLLECTOR);

        assertThat(controller.finished()).isFalse();
    }

    @Test
    void finishedIsIdempotentBetweenTicks() {
        AbstractAgentController controller = controller(new AStarPathPlanner());

        for (int tick = 0; tick < 40; tick++) {
            boolean first = controller.finished();
            String summary = controller.describe();
            Map<AgentKind, Position> locations = controller.agentLocations();

            assertThat(controller.finished()).isEqualTo(first);
            assertThat(controller.describe()).isEqualTo(summary);
            assertThat(controller.agentLocations()).isEqualTo(locations);
            controller.tick();
        }
        verify(sink, never()).log(anyString());
    }
}
