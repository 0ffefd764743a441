package org.gridsweep.runtime.goals;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.geometry.euclidean.twod.Segment;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.ConvexHull2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.MonotoneChain;
import org.gridsweep.runtime.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convex hull of a set of hazard cells, used to measure how deep inside a cluster a cell lies.
 * <p>
 * Cells are treated as points at their (col, row) coordinates. Fewer than three points, or a
 * hull that cannot be built, give every cell a depth of 0.
 */
final class HazardHull {
    private static final Logger LOG = LoggerFactory.getLogger(HazardHull.class);

    private final Segment[] boundary;

    private HazardHull(Segment[] boundary) {
        this.boundary = boundary;
    }

    /**
     * Builds the hull of the given cells.
     * @param cells The hazard cells, at least one.
     * @return The hull.
     */
    static HazardHull of(Collection<Position> cells) {
        if (cells.size() < 3) {
            return new HazardHull(new Segment[0]);
        }
        List<Vector2D> points = new ArrayList<>(cells.size());
        for (Position cell : cells) {
            points.add(toPoint(cell));
        }
        try {
            ConvexHull2D hull = new MonotoneChain(false).generate(points);
            return new HazardHull(hull.getLineSegments());
        } catch (ConvergenceException e) {
            LOG.debug("Convex hull of {} cells could not be built, ignoring cluster depth: {}",
                    cells.size(), e.getMessage());
            return new HazardHull(new Segment[0]);
        }
    }

    /**
     * Returns the Euclidean distance from a cell to the closest hull edge.
     * @param cell A cell inside or on the hull.
     * @return The depth, 0 on the boundary or for degenerate hulls.
     */
    double depth(Position cell) {
        if (boundary.length == 0) {
            return 0.0;
        }
        Vector2D point = toPoint(cell);
        double min = Double.MAX_VALUE;
        for (Segment edge : boundary) {
            min = Math.min(min, edge.distance(point));
        }
        return min;
    }

    private static Vector2D toPoint(Position cell) {
        return new Vector2D(cell.col(), cell.row());
    }
}
