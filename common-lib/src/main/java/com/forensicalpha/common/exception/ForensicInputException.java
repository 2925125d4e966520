package com.forensicalpha.common.exception;

/**
 * Raised when a caller violates the input contract of the forensic alpha pipeline:
 * a minimum-signal threshold outside [1, 4], a non-finite score, or a missing series.
 * Degenerate but valid data (too few years, zero variance, all years filtered) never
 * raises this.
 */
public class ForensicInputException extends RuntimeException {

    public ForensicInputException(String message) {
        super(message);
    }
}
