package com.last9.shared.mcp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.last9.shared.telemetry.exception.TelemetryException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error payload returned as the text result of a failed tool call.
 *
 * Format:
 * {
 *   "status": "error",
 *   "kind": "VALIDATION",
 *   "error": "Failed to query logs",
 *   "message": "log query uses unsupported fields: foo",
 *   "timestamp": "2024-01-01T00:00:00Z",
 *   "context": {...}  // optional
 * }
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolError {

    public static final String STATUS_ERROR = "error";
    public static final String KIND_INTERNAL = "INTERNAL";

    @JsonProperty("status")
    private String status;

    /**
     * Error category, one of the telemetry error kinds or INTERNAL
     */
    @JsonProperty("kind")
    private String kind;

    /**
     * Short summary of what the tool was doing
     */
    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("context")
    private Map<String, Object> context;

    /**
     * Create an error from a typed telemetry failure
     */
    public static ToolError from(String error, TelemetryException e) {
        Map<String, Object> ctx = e.getContext().isEmpty() ? null : e.getContext();
        return new ToolError(STATUS_ERROR, e.getKind().name(), error, e.getMessage(), Instant.now().toString(), ctx);
    }

    /**
     * Create an error for an unexpected failure
     */
    public static ToolError internal(String error, String message) {
        return new ToolError(STATUS_ERROR, KIND_INTERNAL, error, message, Instant.now().toString(), null);
    }
}
