package org.gridsweep.runtime.spi;

import org.gridsweep.runtime.model.GridModel;

/**
 * Builds the initial grid of a run. The core does not care how the grid is produced.
 */
public interface IGridGenerator {

    /**
     * Generates a fresh grid.
     *
     * @param spec Dimensions and content mix.
     * @return The new grid, exclusively owned by the caller.
     */
    GridModel generate(GridSpec spec);
}
