package com.last9.shared.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TraceRecord(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("span_kind") String spanKind,
        @JsonProperty("span_name") String spanName,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("duration_ms") double durationMs,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("trace_state") String traceState,
        @JsonProperty("status_code") String statusCode,
        @JsonProperty("status_message") String statusMessage) {
}
