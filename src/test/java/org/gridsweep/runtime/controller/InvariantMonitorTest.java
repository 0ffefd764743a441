package org.gridsweep.runtime.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Mop;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.model.Vacuum;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InvariantMonitorTest {

    private final InvariantMonitor monitor = new InvariantMonitor();

    @Test
    void consistentAgentsPass() {
        GridModel grid = GridModel.parse("t . .");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 1);
        collector.cleanUp(grid);

        assertThat(monitor.check(3, List.of(collector, new Vacuum(Position.of(0, 1)), new Mop(Position.of(0, 2)))))
                .isEmpty();
    }

    @Test
    void sharedCellIsACollision() {
        List<InvariantViolation> violations = monitor.check(7,
                List.of(new Vacuum(Position.of(1, 1)), new Mop(Position.of(1, 1))));

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.type()).isEqualTo(InvariantViolation.Type.COLLISION);
            assertThat(v.tick()).isEqualTo(7);
            assertThat(v.describe()).isEqualTo("COLLISION violation after tick 7: VACUUM and MOP both occupy (1,1)");
        });
    }

    @Test
    void loadAboveCapacityIsAnOverflow() {
        GarbageCollector collector = collector(6, 5, GarbageCollector.Mode.RETURNING_TO_BIN);

        assertThat(monitor.check(1, List.of(collector)))
                .extracting(InvariantViolation::type)
                .containsExactly(InvariantViolation.Type.OVERFLOW);
    }

    @Test
    void fullLoadWithoutBinTripIsAnOverflow() {
        GarbageCollector collector = collector(5, 5, GarbageCollector.Mode.COLLECTING);

        assertThat(monitor.check(1, List.of(collector)))
                .extracting(InvariantViolation::detail)
                .containsExactly("full load 5 without a bin trip (mode COLLECTING)");
    }

    private static GarbageCollector collector(int load, int capacity, GarbageCollector.Mode mode) {
        GarbageCollector collector = mock(GarbageCollector.class);
        when(collector.position()).thenReturn(Position.of(0, 0));
        when(collector.kind()).thenReturn(AgentKind.GARBAGE_COLLECTOR);
        when(collector.load()).thenReturn(load);
        when(collector.capacity()).thenReturn(capacity);
        when(collector.isFull()).thenReturn(load >= capacity);
        when(collector.mode()).thenReturn(mode);
        return collector;
    }
}
