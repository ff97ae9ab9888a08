package com.last9.shared.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One log line from a backend stream.
 *
 * @param service   service name from the stream labels
 * @param timestamp RFC3339 UTC, or the raw backend value when it is not a nanosecond epoch
 */
public record LogRecord(
        @JsonProperty("service") String service,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("message") String message,
        @JsonProperty("severity") String severity) {
}
