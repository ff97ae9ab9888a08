package com.last9.mcpserver.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.last9.mcpserver.catalog.AttributeCatalog;
import com.last9.mcpserver.catalog.AttributeCatalogFetcher;
import com.last9.mcpserver.service.PrometheusQueryService;
import com.last9.mcpserver.service.QueryOutcome;
import com.last9.mcpserver.service.TelemetryQueryService;
import com.last9.mcpserver.time.TimeRange;
import com.last9.mcpserver.time.TimeRangeParams;
import com.last9.mcpserver.utility.TimestampFormatUtility;
import com.last9.shared.mcp.protocol.ToolError;
import com.last9.shared.telemetry.exception.TelemetryException;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.TelemetrySignal;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

@Service
@Log4j2
public class TelemetryToolService {

    private static final int ATTRIBUTES_DEFAULT_LOOKBACK = 15;
    private static final int PROMETHEUS_DEFAULT_LOOKBACK = 60;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TelemetryQueryService telemetryQueryService;

    @Autowired
    private AttributeCatalogFetcher attributeCatalogFetcher;

    @Autowired
    private PrometheusQueryService prometheusQueryService;

    @Tool(name = "get_logs",
            description = "Run a JSON log pipeline (filter, parse, aggregate, window_aggregate, select stages) against Last9 logs. "
                    + "Field names are checked against the attributes seen in the window; call get_log_attributes first.")
    public String getLogs(
            @ToolParam(description = "JSON array of pipeline stages, e.g. [{\"type\":\"filter\",\"query\":{\"$eq\":[\"ServiceName\",\"api\"]}}]") String logjsonQuery,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Maximum log entries to return (default 20, max 100)", required = false) Integer limit) {
        return respond("Failed to query logs", () -> recordsResponse(telemetryQueryService.validateAndRunLogs(
                logjsonQuery, new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), limit)));
    }

    @Tool(name = "get_traces",
            description = "Run a JSON trace pipeline against Last9 traces. Field names are checked against the attributes "
                    + "seen in the window; call get_trace_attributes first.")
    public String getTraces(
            @ToolParam(description = "JSON array of pipeline stages, e.g. [{\"type\":\"filter\",\"query\":{\"$gt\":[\"Duration\",\"1000000\"]}}]") String tracejsonQuery,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Maximum spans to return (default 20, max 100)", required = false) Integer limit) {
        return respond("Failed to query traces", () -> recordsResponse(telemetryQueryService.validateAndRunTraces(
                tracejsonQuery, new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), limit)));
    }

    @Tool(name = "get_service_logs",
            description = "Get raw log entries for a service. Severity and body patterns are case-insensitive regexes; "
                    + "patterns of the same kind are OR-ed, different kinds are AND-ed.")
    public String getServiceLogs(
            @ToolParam(description = "Service name") String service,
            @ToolParam(description = "Severity patterns, e.g. [\"error\", \"warn\"]", required = false) List<String> severityFilters,
            @ToolParam(description = "Body patterns, e.g. [\"timeout\", \"failed\"]", required = false) List<String> bodyFilters,
            @ToolParam(description = "Deployment environment", required = false) String env,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Maximum log entries to return (default 20, max 100)", required = false) Integer limit) {
        return respond("Failed to fetch service logs", () -> recordsResponse(telemetryQueryService.serviceLogs(
                service, severityFilters, bodyFilters, env,
                new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), limit)));
    }

    @Tool(name = "get_service_traces",
            description = "Get spans for a service, filtered by span kind (server, client, internal, consumer, producer), "
                    + "span name and status (ok, error, unset)")
    public String getServiceTraces(
            @ToolParam(description = "Service name") String serviceName,
            @ToolParam(description = "Span kinds, e.g. [\"server\"]", required = false) List<String> spanKind,
            @ToolParam(description = "Span name", required = false) String spanName,
            @ToolParam(description = "Status codes, e.g. [\"error\"]", required = false) List<String> statusCode,
            @ToolParam(description = "Deployment environment", required = false) String env,
            @ToolParam(description = "Field to order by (default Duration)", required = false) String order,
            @ToolParam(description = "backward or forward (default backward)", required = false) String direction,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Maximum spans to return (default 10, max 100)", required = false) Integer limit) {
        return respond("Failed to fetch service traces", () -> recordsResponse(telemetryQueryService.serviceTraces(
                serviceName, spanKind, spanName, statusCode, env, order, direction,
                new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), limit)));
    }

    @Tool(name = "get_exceptions",
            description = "List spans that recorded an exception, with type, message, stacktrace and resource details")
    public String getExceptions(
            @ToolParam(description = "Service name", required = false) String serviceName,
            @ToolParam(description = "Span name", required = false) String spanName,
            @ToolParam(description = "Deployment environment", required = false) String deploymentEnvironment,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Maximum exceptions to return (default 20, max 100)", required = false) Integer limit) {
        return respond("Failed to fetch exceptions", () -> recordsResponse(telemetryQueryService.exceptions(
                serviceName, spanName, deploymentEnvironment,
                new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), limit)));
    }

    @Tool(name = "get_log_attributes",
            description = "List log attribute names seen in a window (default last 15 minutes), split into log and resource attributes")
    public String getLogAttributes(
            @ToolParam(description = "Minutes to look back from now (default 15)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Backend region, defaults to the datasource region", required = false) String region) {
        return respond("Failed to fetch log attributes", () -> {
            TimeRange range = telemetryQueryService.resolveTimeRange(
                    new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), ATTRIBUTES_DEFAULT_LOOKBACK);
            AttributeCatalog catalog = attributeCatalogFetcher.fetchLenient(TelemetrySignal.LOGS, range, region);
            ObjectNode response = catalogResponse(catalog, range);
            response.set("log_attributes", objectMapper.valueToTree(catalog.logAttributes()));
            response.set("resource_attributes", objectMapper.valueToTree(catalog.resourceAttributes()));
            return response;
        });
    }

    @Tool(name = "get_trace_attributes",
            description = "List trace attribute names seen in a window (default last 15 minutes)")
    public String getTraceAttributes(
            @ToolParam(description = "Minutes to look back from now (default 15)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso,
            @ToolParam(description = "Backend region, defaults to the datasource region", required = false) String region) {
        return respond("Failed to fetch trace attributes", () -> {
            TimeRange range = telemetryQueryService.resolveTimeRange(
                    new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), ATTRIBUTES_DEFAULT_LOOKBACK);
            return catalogResponse(attributeCatalogFetcher.fetch(TelemetrySignal.TRACES, range, region), range);
        });
    }

    @Tool(name = "prometheus_range_query", description = "Evaluate a PromQL expression over a time range")
    public String prometheusRangeQuery(
            @ToolParam(description = "PromQL expression") String query,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso) {
        return respond("Failed to run PromQL range query", () -> {
            requireText(query, "query");
            TimeRange range = telemetryQueryService.resolveTimeRange(
                    new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), PROMETHEUS_DEFAULT_LOOKBACK);
            return prometheusQueryService.rangeQuery(query, range);
        });
    }

    @Tool(name = "prometheus_instant_query", description = "Evaluate a PromQL expression at a single instant")
    public String prometheusInstantQuery(
            @ToolParam(description = "PromQL expression") String query,
            @ToolParam(description = "Evaluation time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339; defaults to now", required = false) String timeIso) {
        return respond("Failed to run PromQL instant query", () -> {
            requireText(query, "query");
            Instant time = StringUtils.hasText(timeIso) ? parseTime(timeIso) : null;
            return prometheusQueryService.instantQuery(query, time);
        });
    }

    @Tool(name = "prometheus_label_values", description = "List the values of a label across series matching a selector")
    public String prometheusLabelValues(
            @ToolParam(description = "Series selector, e.g. http_requests_total{service=\"api\"}") String matchQuery,
            @ToolParam(description = "Label name") String label,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso) {
        return respond("Failed to fetch label values", () -> {
            requireText(label, "label");
            TimeRange range = telemetryQueryService.resolveTimeRange(
                    new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), PROMETHEUS_DEFAULT_LOOKBACK);
            return prometheusQueryService.labelValues(label, matchQuery, range);
        });
    }

    @Tool(name = "prometheus_labels", description = "List the label names present on series matching a selector")
    public String prometheusLabels(
            @ToolParam(description = "Series selector, e.g. http_requests_total{service=\"api\"}") String matchQuery,
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso) {
        return respond("Failed to fetch labels", () -> {
            requireText(matchQuery, "match_query");
            TimeRange range = telemetryQueryService.resolveTimeRange(
                    new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), PROMETHEUS_DEFAULT_LOOKBACK);
            return prometheusQueryService.labels(matchQuery, range);
        });
    }

    @Tool(name = "get_service_environments",
            description = "List the environments that report server spans. The values can be passed as env to other tools.")
    public String getServiceEnvironments(
            @ToolParam(description = "Minutes to look back from now (1-1440, default 60)", required = false) Integer lookbackMinutes,
            @ToolParam(description = "Start time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String startTimeIso,
            @ToolParam(description = "End time, 'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339", required = false) String endTimeIso) {
        return respond("Failed to fetch service environments", () -> prometheusQueryService.serviceEnvironments(
                telemetryQueryService.resolveTimeRange(
                        new TimeRangeParams(lookbackMinutes, startTimeIso, endTimeIso), PROMETHEUS_DEFAULT_LOOKBACK)));
    }

    private String respond(String error, Supplier<JsonNode> call) {
        try {
            return objectMapper.writeValueAsString(call.get());
        } catch (TelemetryException e) {
            log.warn("{}: {}", error, e.toString());
            return createErrorResponse(ToolError.from(error, e));
        } catch (Exception e) {
            log.error(error, e);
            return createErrorResponse(ToolError.internal(error, e.getMessage()));
        }
    }

    private ObjectNode recordsResponse(QueryOutcome<?> outcome) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("status", "success");
        response.put("start", outcome.range().start().toString());
        response.put("end", outcome.range().end().toString());
        response.put("count", outcome.records().size());
        if (!outcome.warnings().isEmpty()) {
            response.set("warnings", objectMapper.valueToTree(outcome.warnings()));
        }
        response.set("records", objectMapper.valueToTree(outcome.records()));
        return response;
    }

    private ObjectNode catalogResponse(AttributeCatalog catalog, TimeRange range) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("status", "success");
        response.put("start", range.start().toString());
        response.put("end", range.end().toString());
        response.put("count", catalog.getNames().size());
        response.set("attributes", objectMapper.valueToTree(catalog.getNames()));
        catalog.getWarning().ifPresent(w -> response.putArray("warnings").add(w));
        return response;
    }

    private static Instant parseTime(String value) {
        try {
            return TimestampFormatUtility.parseInstant(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid time: " + e.getMessage(), e);
        }
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(name + " is required");
        }
    }

    /**
     * Create standardized error response
     */
    private String createErrorResponse(ToolError error) {
        try {
            return objectMapper.writeValueAsString(error);
        } catch (Exception e) {
            log.error("Failed to serialize error response", e);
            return "{\"error\":\"Failed to create error response\",\"status\":\"error\"}";
        }
    }
}
