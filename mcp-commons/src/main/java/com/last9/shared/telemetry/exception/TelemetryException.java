package com.last9.shared.telemetry.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for telemetry queries, carrying an {@link ErrorKind} and optional
 * key/value context (endpoint, status, field names).
 *
 * <p>Context is copied on construction and exposed unmodifiable.
 */
public abstract class TelemetryException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> context;

    protected TelemetryException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    protected TelemetryException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    protected TelemetryException(ErrorKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.context = copy(context);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Additional details that help diagnosing the error. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{kind=" + kind
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
