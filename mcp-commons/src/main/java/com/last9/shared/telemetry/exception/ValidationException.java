package com.last9.shared.telemetry.exception;

/** Caller input rejected before any backend call is made. */
public class ValidationException extends TelemetryException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
