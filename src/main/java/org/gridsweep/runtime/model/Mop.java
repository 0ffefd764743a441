package org.gridsweep.runtime.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Clears soaked residue.
 */
public class Mop extends Agent {

    private static final Set<Cell> TARGETS = EnumSet.of(Cell.SOAKED);

    public Mop(Position position) {
        super(AgentKind.MOP, position);
    }

    @Override
    public Set<Cell> targetCells(GridModel grid) {
        return TARGETS;
    }

    @Override
    public Agent copy() {
        Mop copy = new Mop(position());
        copyBaseInto(copy);
        return copy;
    }
}
