package org.gridsweep.runtime.coordination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.gridsweep.junit.extensions.logging.LogWatchExtension;
import org.gridsweep.runtime.internal.services.SeededRandomProvider;
import org.gridsweep.runtime.model.Agent;
import org.gridsweep.runtime.model.GarbageCollector;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Mop;
import org.gridsweep.runtime.model.Move;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.model.Vacuum;
import org.gridsweep.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for {@link CollisionAvoidance}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CollisionAvoidanceTest {

    private final CollisionAvoidance avoidance = new CollisionAvoidance(6);

    @Test
    void separationAddsThePriorityOfOthers() {
        GridModel grid = GridModel.parse("t . . . .");
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 1);
        Vacuum vacuum = new Vacuum(Position.of(0, 3));
        List<Agent> agents = List.of(collector, vacuum);

        assertThat(avoidance.separation(vacuum, vacuum.position(), agents)).isEqualTo(4);
        collector.cleanUp(grid);
        assertThat(avoidance.separation(vacuum, vacuum.position(), agents)).isEqualTo(5);
        // the vacuum counts as nothing extra
        assertThat(avoidance.separation(collector, collector.position(), agents)).isEqualTo(3);
        assertThat(avoidance.separation(vacuum, vacuum.position(), List.of(vacuum))).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void candidatesSkipWallsAndOccupiedCells() {
        GridModel grid = GridModel.parse(
                ". # .",
                ". . .",
                ". . .");
        Vacuum vacuum = new Vacuum(Position.of(1, 1));
        Mop mop = new Mop(Position.of(1, 2));

        assertThat(avoidance.candidateMoves(vacuum, grid, List.of(vacuum, mop)))
                .containsExactly(Move.STAY, Move.DOWN, Move.LEFT);
    }

    @Test
    void evadeBreaksTiesWithTheSeededSource() {
        GridModel grid = new GridModel(5, 5);
        Vacuum vacuum = new Vacuum(Position.of(2, 2));
        Mop mop = new Mop(Position.of(2, 3));
        GarbageCollector collector = new GarbageCollector(Position.of(0, 0), 5);
        List<Agent> agents = List.of(collector, vacuum, mop);
        Set<Move> seen = EnumSet.noneOf(Move.class);

        for (long seed = 0; seed < 50; seed++) {
            Move first = avoidance.evade(vacuum, grid, agents, new SeededRandomProvider(seed));
            Move again = avoidance.evade(vacuum, grid, agents, new SeededRandomProvider(seed));
            assertThat(again).isEqualTo(first);
            seen.add(first);
        }

        assertThat(seen).containsExactlyInAnyOrder(Move.UP, Move.DOWN, Move.LEFT);
    }

    @Test
    void uniqueBestMoveNeedsNoRandomness() {
        GridModel grid = GridModel.parse(". . .");
        Vacuum vacuum = new Vacuum(Position.of(0, 1));
        Mop mop = new Mop(Position.of(0, 0));
        IRandomProvider random = mock(IRandomProvider.class);

        assertThat(avoidance.evade(vacuum, grid, List.of(vacuum, mop), random)).isEqualTo(Move.RIGHT);
        verifyNoInteractions(random);
    }

    @Test
    void comfortableOnlyAboveThreshold() {
        GridModel grid = new GridModel(1, 9);
        Vacuum vacuum = new Vacuum(Position.of(0, 0));
        Mop mop = new Mop(Position.of(0, 7));

        assertThat(avoidance.isComfortable(vacuum, List.of(vacuum, mop))).isTrue();
        mop.moveTo(Position.of(0, 6));
        assertThat(avoidance.isComfortable(vacuum, List.of(vacuum, mop))).isFalse();
        assertThat(grid.isWalkable(mop.position())).isTrue();
    }

    @Test
    void conflictedWhenThePreferredCellIsTakenOrBlocked() {
        GridModel grid = GridModel.parse(
                "# . .",
                ". . .");
        Vacuum vacuum = new Vacuum(Position.of(0, 1));
        Mop mop = new Mop(Position.of(0, 2));
        List<Agent> agents = List.of(vacuum, mop);

        assertThat(avoidance.isConflicted(vacuum, Move.RIGHT, grid, agents)).isTrue();
        assertThat(avoidance.isConflicted(vacuum, Move.LEFT, grid, agents)).isTrue();
        assertThat(avoidance.isConflicted(vacuum, Move.DOWN, grid, agents)).isFalse();
        assertThat(avoidance.isConflicted(vacuum, Move.STAY, grid, agents)).isFalse();
    }
}
