package org.gridsweep.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsWarningsAndErrorsOnly() {
        assertThat(LogLevelHighlightConverter.colorFor(Level.ERROR)).isEqualTo("\u001B[31m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.WARN)).isEqualTo("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.INFO)).isEqualTo("\u001B[34m");
        assertThat(LogLevelHighlightConverter.colorFor(Level.DEBUG)).isEmpty();
    }
}
