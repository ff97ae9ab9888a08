package com.last9.shared.telemetry.exception;

/** Malformed JSON or JWT, or a required claim/field missing from a decoded payload. */
public class DecodeException extends TelemetryException {

    public DecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
