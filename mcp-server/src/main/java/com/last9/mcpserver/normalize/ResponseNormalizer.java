package com.last9.mcpserver.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.last9.mcpserver.utility.TimestampFormatUtility;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.model.ExceptionRecord;
import com.last9.shared.telemetry.model.LogRecord;
import com.last9.shared.telemetry.model.TraceRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens backend query responses into typed records. Stateless.
 */
@Component
public class ResponseNormalizer {

    private static final double NANOS_PER_MILLI = 1_000_000d;

    private static final String[] SERVICE_LABELS = {"service_name", "ServiceName", "service"};
    private static final String[] SEVERITY_LABELS = {"severity", "SeverityText", "level"};
    private static final String[] SPAN_ATTRIBUTE_KEYS = {"SpanAttributes", "attributes"};
    private static final String[] EVENT_ATTRIBUTE_KEYS = {"Events.Attributes", "events_attributes"};
    private static final String[] RESOURCE_ATTRIBUTE_KEYS = {"ResourceAttributes", "resources"};

    /**
     * Normalize a log stream response: one record per (stream, value) pair.
     *
     * @param defaultService service used when a stream carries no service label
     * @param limit          maximum records emitted; zero or negative means unbounded
     */
    public List<LogRecord> normalizeLogs(JsonNode response, String defaultService, int limit) {
        JsonNode streams = result(response, false);
        List<LogRecord> records = new ArrayList<>();
        for (JsonNode stream : streams) {
            JsonNode labels = stream.path("stream");
            String service = firstText(labels, SERVICE_LABELS).orElse(defaultService == null ? "" : defaultService);
            String severity = firstText(labels, SEVERITY_LABELS).orElse("");
            for (JsonNode value : stream.path("values")) {
                if (limit > 0 && records.size() >= limit) {
                    return records;
                }
                if (!value.isArray() || value.size() < 2) {
                    continue;
                }
                records.add(new LogRecord(service, timestamp(value.get(0)), value.get(1).asText(), severity));
            }
        }
        return records;
    }

    /**
     * Normalize a trace query response. Duration is converted from nanoseconds to milliseconds.
     */
    public List<TraceRecord> normalizeTraces(JsonNode response) {
        List<TraceRecord> records = new ArrayList<>();
        for (JsonNode item : result(response, true)) {
            if (!item.isObject()) {
                continue;
            }
            records.add(new TraceRecord(
                    text(item, "TraceId"),
                    text(item, "SpanId"),
                    text(item, "SpanKind"),
                    text(item, "SpanName"),
                    text(item, "ServiceName"),
                    durationMs(item.path("Duration")),
                    TimestampFormatUtility.normalizeRfc3339(text(item, "Timestamp")),
                    text(item, "TraceState"),
                    text(item, "StatusCode"),
                    text(item, "StatusMessage")));
        }
        return records;
    }

    /**
     * Promote every trace item that carries an exception.type attribute to an exception record.
     */
    public List<ExceptionRecord> normalizeExceptions(JsonNode response) {
        List<ExceptionRecord> records = new ArrayList<>();
        for (JsonNode item : result(response, true)) {
            promote(item).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Span attributes are read from SpanAttributes/attributes, falling back to the first entry of
     * the events attributes list. Resource attributes come from ResourceAttributes/resources.
     */
    public Optional<ExceptionRecord> promote(JsonNode item) {
        JsonNode attributes = exceptionAttributes(item);
        String exceptionType = text(attributes, "exception.type");
        if (exceptionType.isEmpty()) {
            return Optional.empty();
        }
        JsonNode resources = firstObject(item, RESOURCE_ATTRIBUTE_KEYS);
        return Optional.of(new ExceptionRecord(
                text(item, "TraceId"),
                text(item, "SpanId"),
                text(item, "ServiceName"),
                text(item, "SpanName"),
                text(item, "SpanKind"),
                TimestampFormatUtility.normalizeRfc3339(text(item, "Timestamp")),
                durationMs(item.path("Duration")),
                text(item, "StatusCode"),
                exceptionType,
                text(attributes, "exception.message"),
                text(attributes, "exception.stacktrace"),
                text(attributes, "exception.escaped"),
                text(resources, "deployment.environment"),
                text(resources, "service.namespace"),
                text(resources, "service.instance.id")));
    }

    private static JsonNode exceptionAttributes(JsonNode item) {
        for (String key : SPAN_ATTRIBUTE_KEYS) {
            JsonNode attributes = item.path(key);
            if (attributes.isObject() && attributes.has("exception.type")) {
                return attributes;
            }
        }
        for (String key : EVENT_ATTRIBUTE_KEYS) {
            JsonNode events = item.path(key);
            if (events.isArray() && events.size() > 0 && events.get(0).isObject()) {
                return events.get(0);
            }
        }
        return firstObject(item, SPAN_ATTRIBUTE_KEYS);
    }

    private static JsonNode result(JsonNode response, boolean allowTopLevel) {
        JsonNode nested = response.path("data").path("result");
        if (nested.isArray()) {
            return nested;
        }
        if (allowTopLevel && response.path("result").isArray()) {
            return response.get("result");
        }
        throw new DecodeException("invalid response structure: missing data.result array");
    }

    private static String timestamp(JsonNode value) {
        if (value.isNumber()) {
            return TimestampFormatUtility.formatEpochNanos(value.asLong());
        }
        return TimestampFormatUtility.formatEpochNanos(value.asText());
    }

    private static double durationMs(JsonNode duration) {
        if (duration.isNumber()) {
            return duration.asDouble() / NANOS_PER_MILLI;
        }
        if (duration.isTextual()) {
            try {
                return Double.parseDouble(duration.asText()) / NANOS_PER_MILLI;
            } catch (NumberFormatException e) {
                throw new DecodeException("invalid Duration value: " + duration.asText(), e);
            }
        }
        return 0d;
    }

    private static JsonNode firstObject(JsonNode item, String[] keys) {
        for (String key : keys) {
            if (item.path(key).isObject()) {
                return item.get(key);
            }
        }
        return MissingNode.getInstance();
    }

    private static Optional<String> firstText(JsonNode node, String[] keys) {
        for (String key : keys) {
            JsonNode value = node.path(key);
            if (value.isValueNode() && !value.isNull() && !value.asText().isEmpty()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.path(key);
        return value.isValueNode() && !value.isNull() ? value.asText() : "";
    }
}
