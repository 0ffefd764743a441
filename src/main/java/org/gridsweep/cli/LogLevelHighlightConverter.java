package org.gridsweep.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level of console output: ERROR red, WARN yellow,
 * INFO blue, everything else uncolored.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorFor(event.getLevel()) + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            default -> "";
        };
    }
}
