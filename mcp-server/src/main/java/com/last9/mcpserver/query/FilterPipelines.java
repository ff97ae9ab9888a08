package com.last9.mcpserver.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the single-filter pipelines behind the structured service log, service trace and
 * exception tools.
 */
@Component
public class FilterPipelines {

    public static final String ENVIRONMENT_FIELD = "resources['deployment.environment']";
    public static final String EXCEPTION_TYPE_FIELD = "attributes['exception.type']";

    private static final Map<String, String> SPAN_KINDS = Map.ofEntries(
            Map.entry("server", "SPAN_KIND_SERVER"),
            Map.entry("client", "SPAN_KIND_CLIENT"),
            Map.entry("internal", "SPAN_KIND_INTERNAL"),
            Map.entry("consumer", "SPAN_KIND_CONSUMER"),
            Map.entry("producer", "SPAN_KIND_PRODUCER"),
            Map.entry("span_kind_server", "SPAN_KIND_SERVER"),
            Map.entry("span_kind_client", "SPAN_KIND_CLIENT"),
            Map.entry("span_kind_internal", "SPAN_KIND_INTERNAL"),
            Map.entry("span_kind_consumer", "SPAN_KIND_CONSUMER"),
            Map.entry("span_kind_producer", "SPAN_KIND_PRODUCER"));

    private static final Map<String, String> STATUS_CODES = Map.of(
            "unset", "STATUS_CODE_UNSET",
            "error", "STATUS_CODE_ERROR",
            "ok", "STATUS_CODE_OK",
            "success", "STATUS_CODE_OK",
            "status_code_unset", "STATUS_CODE_UNSET",
            "status_code_error", "STATUS_CODE_ERROR",
            "status_code_ok", "STATUS_CODE_OK");

    private final ObjectMapper objectMapper;

    public FilterPipelines(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * ServiceName equality plus case-insensitive regex alternatives on severity and body.
     * Blank patterns are skipped.
     */
    public ArrayNode serviceLogs(String serviceName, List<String> severityFilters, List<String> bodyFilters) {
        ArrayNode and = objectMapper.createArrayNode();
        and.add(op("$eq", "ServiceName", serviceName));
        addRegexAlternatives(and, "SeverityText", severityFilters);
        addRegexAlternatives(and, "Body", bodyFilters);
        return filterPipeline(and);
    }

    /**
     * ServiceName equality with optional span kind, span name, status code and environment
     * filters. Friendly span kind and status names map to their OTLP constants.
     */
    public ArrayNode serviceTraces(String serviceName, List<String> spanKinds, String spanName,
                                   List<String> statusCodes, String environment) {
        ArrayNode and = objectMapper.createArrayNode();
        and.add(op("$eq", "ServiceName", serviceName));
        addEqAlternatives(and, "SpanKind", spanKinds, SPAN_KINDS);
        if (StringUtils.hasText(spanName)) {
            and.add(op("$eq", "SpanName", spanName));
        }
        addEqAlternatives(and, "StatusCode", statusCodes, STATUS_CODES);
        if (StringUtils.hasText(environment)) {
            and.add(op("$eq", ENVIRONMENT_FIELD, environment));
        }
        return filterPipeline(and);
    }

    /**
     * Spans with a non-empty exception.type attribute, optionally narrowed by service, span
     * name and environment.
     */
    public ArrayNode exceptions(String serviceName, String spanName, String environment) {
        ArrayNode and = objectMapper.createArrayNode();
        ObjectNode exists = objectMapper.createObjectNode();
        exists.putArray("$exists").add(EXCEPTION_TYPE_FIELD);
        and.add(exists);
        and.add(op("$neq", EXCEPTION_TYPE_FIELD, ""));
        if (StringUtils.hasText(serviceName)) {
            and.add(op("$eq", "ServiceName", serviceName));
        }
        if (StringUtils.hasText(spanName)) {
            and.add(op("$eq", "SpanName", spanName));
        }
        if (StringUtils.hasText(environment)) {
            and.add(op("$eq", ENVIRONMENT_FIELD, environment));
        }
        return filterPipeline(and);
    }

    static String mapValue(String value, Map<String, String> mapping) {
        return mapping.getOrDefault(value.toLowerCase(Locale.ROOT), value);
    }

    private void addRegexAlternatives(ArrayNode and, String field, List<String> patterns) {
        if (patterns == null) {
            return;
        }
        ArrayNode or = objectMapper.createArrayNode();
        for (String pattern : patterns) {
            if (StringUtils.hasText(pattern)) {
                or.add(op("$regex", field, "(?i)" + pattern));
            }
        }
        if (!or.isEmpty()) {
            and.addObject().set("$or", or);
        }
    }

    private void addEqAlternatives(ArrayNode and, String field, List<String> values, Map<String, String> mapping) {
        if (values == null) {
            return;
        }
        ArrayNode or = objectMapper.createArrayNode();
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                or.add(op("$eq", field, mapValue(value, mapping)));
            }
        }
        if (!or.isEmpty()) {
            and.addObject().set("$or", or);
        }
    }

    private ObjectNode op(String operator, String field, String value) {
        ObjectNode node = objectMapper.createObjectNode();
        node.putArray(operator).add(field).add(value);
        return node;
    }

    private ArrayNode filterPipeline(ArrayNode and) {
        ArrayNode pipeline = objectMapper.createArrayNode();
        ObjectNode stage = pipeline.addObject();
        stage.put("type", "filter");
        stage.putObject("query").set("$and", and);
        return pipeline;
    }
}
