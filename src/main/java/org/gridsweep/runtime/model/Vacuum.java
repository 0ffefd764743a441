package org.gridsweep.runtime.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Clears dusty residue.
 */
public class Vacuum extends Agent {

    private static final Set<Cell> TARGETS = EnumSet.of(Cell.DUSTY);

    public Vacuum(Position position) {
        super(AgentKind.VACUUM, position);
    }

    @Override
    public Set<Cell> targetCells(GridModel grid) {
        return TARGETS;
    }

    @Override
    public Agent copy() {
        Vacuum copy = new Vacuum(position());
        copyBaseInto(copy);
        return copy;
    }
}
