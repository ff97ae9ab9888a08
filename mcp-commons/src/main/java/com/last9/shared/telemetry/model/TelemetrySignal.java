package com.last9.shared.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Telemetry signal a pipeline runs against, with the field names that are always valid for it.
 */
public enum TelemetrySignal {

    LOGS("log", List.of("Body", "ServiceName", "SeverityText", "Timestamp")),
    TRACES("trace", List.of("TraceId", "SpanId", "ServiceName", "SpanName", "SpanKind",
            "StatusCode", "StatusMessage", "Timestamp", "Duration"));

    private final String label;
    private final Set<String> standardFields;

    TelemetrySignal(String label, List<String> standardFields) {
        this.label = label;
        this.standardFields = Collections.unmodifiableSet(new LinkedHashSet<>(standardFields));
    }

    /** Lower-case noun used in messages, e.g. "log query uses unsupported fields". */
    public String getLabel() {
        return label;
    }

    public Set<String> getStandardFields() {
        return standardFields;
    }
}
