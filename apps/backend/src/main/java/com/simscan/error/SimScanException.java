package com.simscan.error;

/**
 * Base type for every business and infrastructure failure surfaced by the scan subsystem.
 * The {@link #reason()} code is stable and ends up in API error bodies.
 */
public abstract class SimScanException extends RuntimeException {

    protected SimScanException(String message) {
        super(message);
    }

    protected SimScanException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reason();
}
