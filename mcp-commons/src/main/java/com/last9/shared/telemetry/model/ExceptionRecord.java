package com.last9.shared.telemetry.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A span that recorded an exception, with the exception attributes and the resource
 * attributes that locate the emitting process.
 */
public record ExceptionRecord(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("span_name") String spanName,
        @JsonProperty("span_kind") String spanKind,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("duration_ms") double durationMs,
        @JsonProperty("status_code") String statusCode,
        @JsonProperty("exception_type") String exceptionType,
        @JsonProperty("exception_message") String exceptionMessage,
        @JsonProperty("exception_stacktrace") String exceptionStacktrace,
        @JsonProperty("exception_escaped") String exceptionEscaped,
        @JsonProperty("deployment_environment") String deploymentEnvironment,
        @JsonProperty("service_namespace") String serviceNamespace,
        @JsonProperty("service_instance_id") String serviceInstanceId) {
}
