package com.di.samplenova.util;

import org.slf4j.Logger;

/**
 * Receives non-fatal warnings raised while grouping and allocating.
 * Components emit through a sink so callers (and tests) decide where warnings go.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void warn(String message);

    /**
     * Sink writing every diagnostic at WARN level to the given logger.
     */
    static DiagnosticSink logging(Logger logger) {
        return message -> logger.warn(message);
    }
}
