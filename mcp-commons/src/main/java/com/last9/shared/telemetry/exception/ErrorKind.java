package com.last9.shared.telemetry.exception;

/**
 * Failure categories surfaced by the telemetry query pipeline.
 */
public enum ErrorKind {
    /** Bad time range, unsupported field, malformed stage. Returned to the caller verbatim. */
    VALIDATION,
    /** Non-2xx response or transport failure talking to the backend. */
    UPSTREAM,
    /** Malformed JSON, JWT, or a missing claim. */
    DECODE
}
