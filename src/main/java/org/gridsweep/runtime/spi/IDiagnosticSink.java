package org.gridsweep.runtime.spi;

/**
 * Receives diagnostic messages about anomalies detected by the simulation core, such as
 * invariant violations. The core has no dependency on how messages are stored or shown.
 */
@FunctionalInterface
public interface IDiagnosticSink {

    /**
     * Logs a diagnostic message.
     * @param message The human-readable message.
     */
    void log(String message);
}
