package org.gridsweep.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class GarbageCollectorTest {

    @Test
    void fillingUpForcesBinTrip() {
        GridModel grid = GridModel.parse("t t t B");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 2);

        assertThat(collector.cleanUp(grid)).isEqualTo(1);
        assertThat(collector.mode()).isEqualTo(GarbageCollector.Mode.COLLECTING);
        collector.moveTo(Position.of(0, 1));
        collector.cleanUp(grid);

        assertThat(collector.load()).isEqualTo(2);
        assertThat(collector.isFull()).isTrue();
        assertThat(collector.mode()).isEqualTo(GarbageCollector.Mode.RETURNING_TO_BIN);
        assertThat(collector.targetCells(grid)).containsExactly(Cell.BIN);

        // full: standing on trash changes nothing
        collector.moveTo(Position.of(0, 2));
        assertThat(collector.cleanUp(grid)).isZero();
        assertThat(grid.cellAt(Position.of(0, 2))).isEqualTo(Cell.DRY_TRASH);
        assertThat(collector.load()).isEqualTo(2);
    }

    @Test
    void binEmptiesLoadAndResumesCollecting() {
        GridModel grid = GridModel.parse("t B t");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 1);
        collector.cleanUp(grid);

        collector.moveTo(Position.of(0, 1));
        assertThat(collector.cleanUp(grid)).isZero();

        assertThat(collector.load()).isZero();
        assertThat(collector.mode()).isEqualTo(GarbageCollector.Mode.COLLECTING);
        assertThat(collector.targetCells(grid)).isEqualTo(Cell.TRASH);
        assertThat(grid.cellAt(Position.of(0, 1))).isEqualTo(Cell.BIN);
    }

    @Test
    void returnsToBinWhenNoTrashIsLeft() {
        GridModel grid = GridModel.parse("t . B");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 5);
        collector.cleanUp(grid);

        assertThat(collector.updateMode(grid)).isTrue();
        assertThat(collector.mode()).isEqualTo(GarbageCollector.Mode.RETURNING_TO_BIN);
        assertThat(collector.updateMode(grid)).isFalse();
    }

    @Test
    void idleWithoutTrashOrLoad() {
        GridModel grid = GridModel.parse("d . B");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 1), 5);

        assertThat(collector.updateMode(grid)).isFalse();
        assertThat(collector.targetCells(grid)).isEmpty();
    }

    @Test
    void priorityRisesWhenFull() {
        GridModel grid = GridModel.parse("t");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 1);
        assertThat(collector.priority()).isEqualTo(1);

        collector.cleanUp(grid);

        assertThat(collector.priority()).isEqualTo(2);
        assertThat(new Vacuum(Position.of(0, 0)).priority()).isZero();
        assertThat(new Mop(Position.of(0, 0)).priority()).isZero();
    }

    @Test
    void copyIsIndependent() {
        GridModel grid = GridModel.parse("t");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 3);
        collector.setGoal(Position.of(0, 0));
        GarbageCollector copy = (GarbageCollector) collector.copy();

        collector.cleanUp(grid);
        collector.clearGoal();

        assertThat(copy.load()).isZero();
        assertThat(copy.goal()).isEqualTo(Position.of(0, 0));
        assertThat(copy.capacity()).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new GarbageCollector(Position.of(0, 0), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
