package org.gridsweep.runtime.worldgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.gridsweep.runtime.model.Cell;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;
import org.gridsweep.runtime.spi.GridSpec;
import org.gridsweep.runtime.spi.IGridGenerator;
import org.gridsweep.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a grid with randomly placed bins and trash.
 * <ul>
 *   <li><b>bin-count:</b> bins are placed first, on distinct random cells.</li>
 *   <li><b>fill-probability:</b> every remaining cell independently receives trash with this
 *   probability.</li>
 *   <li><b>wet-ratio:</b> share of trash cells that are wet; the rest are dry.</li>
 * </ul>
 * No walls are generated; walls only come from explicit edits.
 */
public class RandomGridGenerator implements IGridGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(RandomGridGenerator.class);

    private final Random random;

    /**
     * Creates a generator.
     * @param randomProvider The source of randomness.
     */
    public RandomGridGenerator(IRandomProvider randomProvider) {
        this.random = randomProvider.asJavaRandom();
    }

    @Override
    public GridModel generate(GridSpec spec) {
        GridModel grid = new GridModel(spec.rows(), spec.cols());

        final List<Position> cells = new ArrayList<>(grid.area());
        grid.forEachIndex(index -> cells.add(grid.positionOf(index)));
        Collections.shuffle(cells, random);

        for (int i = 0; i < spec.binCount(); i++) {
            grid.paint(cells.get(i), Cell.BIN);
        }
        for (int i = spec.binCount(); i < cells.size(); i++) {
            if (random.nextDouble() < spec.fillProbability()) {
                Cell trash = random.nextDouble() < spec.wetRatio() ? Cell.WET_TRASH : Cell.DRY_TRASH;
                grid.paint(cells.get(i), trash);
            }
        }

        LOG.debug("Generated {}x{} grid: {} dry, {} wet, {} bins",
                spec.rows(), spec.cols(), grid.count(Cell.DRY_TRASH), grid.count(Cell.WET_TRASH), grid.count(Cell.BIN));
        return grid;
    }
}
