package org.gridsweep.runtime.internal.services;

import org.gridsweep.runtime.spi.IDiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default diagnostic sink that forwards every message to SLF4J at WARN level.
 */
public final class Slf4jDiagnosticSink implements IDiagnosticSink {
    private static final Logger LOG = LoggerFactory.getLogger(Slf4jDiagnosticSink.class);

    @Override
    public void log(String message) {
        LOG.warn(message);
    }
}
