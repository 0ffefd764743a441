package org.gridsweep.runtime.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.gridsweep.runtime.Simulation;
import org.gridsweep.runtime.SimulationFactory;
import org.gridsweep.runtime.SimulationSettings;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.spi.GridSpec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Runs both strategies over many seeds and checks the per-tick invariants on every committed tick.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ControllerPropertyTest {

    private static final int SEEDS = 12;
    private static final int CAPACITY = 3;

    @ParameterizedTest
    @EnumSource(Strategy.class)
    void invariantsHoldOnEveryTickForManySeeds(Strategy strategy) {
        for (long seed = 1; seed <= SEEDS; seed++) {
            List<String> diagnostics = new ArrayList<>();
            SimulationSettings settings = new SimulationSettings(
                    new GridSpec(8, 8, 0.4, 0.5, 2), CAPACITY, seed % 2 == 0,
                    2, 1.0, 6, 20, 500, 0, strategy, seed);
            Simulation simulation = SimulationFactory.create(settings, diagnostics::add);
            AbstractAgentController controller = (AbstractAgentController) simulation.getController();

            boolean committedToBin = false;
            while (simulation.tick()) {
                GarbageCollector collector = (GarbageCollector) controller.agent(AgentKind.GARBAGE_COLLECTOR);
                assertThat(new HashSet<>(controller.agentLocations().values()))
                        .as("seed %d tick %d", seed, simulation.getCurrentTick())
                        .hasSize(AgentKind.values().length);
                assertThat(collector.load()).isLessThanOrEqualTo(collector.capacity());

                if (collector.isFull()) {
                    committedToBin = true;
                }
                if (collector.load() == 0) {
                    committedToBin = false;
                }
                if (committedToBin) {
                    assertThat(collector.mode()).isEqualTo(GarbageCollector.Mode.RETURNING_TO_BIN);
                    assertThat(collector.goal() == null
                            || controller.grid().cellAt(collector.goal()) == Cell.BIN).isTrue();
                }
            }

            assertThat(simulation.getStatus()).as("seed %d", seed).isEqualTo(Simulation.Status.FINISHED);
            assertThat(controller.grid().contains(Cell.HAZARDS)).isFalse();
            assertThat(diagnostics).as("seed %d", seed).isEmpty();
        }
    }
}
