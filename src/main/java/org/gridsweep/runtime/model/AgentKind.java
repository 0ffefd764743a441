package org.gridsweep.runtime.model;

/**
 * The fixed set of agent kinds. Declaration order is the stepping order within a tick.
 */
public enum AgentKind {
    GARBAGE_COLLECTOR('G'),
    VACUUM('V'),
    MOP('M');

    private final char symbol;

    AgentKind(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }
}
