package org.gridsweep.runtime.spi;

import java.util.Map;

import org.gridsweep.runtime.model.AgentKind;
import org.gridsweep.runtime.model.GridModel;
import org.gridsweep.runtime.model.Position;

/**
 * Supplies the initial position of every agent kind.
 */
public interface IStartPositionProvider {

    /**
     * Returns one walkable start position per agent kind. Positions must be pairwise distinct.
     *
     * @param grid The initial grid.
     * @return Start positions keyed by agent kind.
     */
    Map<AgentKind, Position> startPositions(GridModel grid);
}
