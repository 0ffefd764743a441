package org.gridsweep.runtime.spi;

import com.typesafe.config.Config;

/**
 * Parameters for generating an initial grid.
 *
 * @param rows Number of rows.
 * @param cols Number of columns.
 * @param fillProbability Probability that a free cell receives trash, in [0, 1].
 * @param wetRatio Share of trash cells that are wet rather than dry, in [0, 1].
 * @param binCount Number of bin cells to place.
 */
public record GridSpec(int rows, int cols, double fillProbability, double wetRatio, int binCount) {

    public GridSpec {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + rows + "x" + cols);
        }
        if (fillProbability < 0.0 || fillProbability > 1.0) {
            throw new IllegalArgumentException("fill-probability must be in [0, 1], got " + fillProbability);
        }
        if (wetRatio < 0.0 || wetRatio > 1.0) {
            throw new IllegalArgumentException("wet-ratio must be in [0, 1], got " + wetRatio);
        }
        if (binCount < 0 || binCount > (long) rows * cols) {
            throw new IllegalArgumentException("bin-count must be in [0, rows*cols], got " + binCount);
        }
    }

    /**
     * Reads a spec from the {@code simulation.grid} configuration block.
     * @param config Block with rows, cols, fill-probability, wet-ratio and bin-count.
     * @return The spec.
     */
    public static GridSpec fromConfig(Config config) {
        return new GridSpec(
                config.getInt("rows"),
                config.getInt("cols"),
                config.getDouble("fill-probability"),
                config.getDouble("wet-ratio"),
                config.getInt("bin-count"));
    }
}
