package com.last9.mcpserver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.last9.mcpserver.catalog.AttributeCatalog;
import com.last9.mcpserver.catalog.AttributeCatalogFetcher;
import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.mcpserver.normalize.ResponseNormalizer;
import com.last9.mcpserver.query.FilterPipelines;
import com.last9.mcpserver.query.PipelineParser;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.mcpserver.request.BackendRequest;
import com.last9.mcpserver.request.QueryOptions;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.mcpserver.session.SessionContext;
import com.last9.mcpserver.time.TimeRange;
import com.last9.mcpserver.time.TimeRangeParams;
import com.last9.mcpserver.time.TimeRangeResolver;
import com.last9.mcpserver.validation.PipelineQueryValidator;
import com.last9.shared.telemetry.exception.TelemetryException;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.ExceptionRecord;
import com.last9.shared.telemetry.model.LogRecord;
import com.last9.shared.telemetry.model.TelemetrySignal;
import com.last9.shared.telemetry.model.TraceRecord;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service orchestrating telemetry queries
 *
 * Flow for free-form pipelines:
 * 1. Resolve the time window
 * 2. Parse the pipeline
 * 3. Discover the attribute catalog (lenient for logs, fatal for traces)
 * 4. Validate field references
 * 5. Build and execute the backend request
 * 6. Normalize the response
 *
 * Structured service/exception queries skip steps 3-4; their filters are built here.
 */
@Service
@Log4j2
public class TelemetryQueryService {

    private static final String SERVICE_TRACES_ORDER = "Duration";

    private final TimeRangeResolver timeRangeResolver;
    private final SessionContext sessionContext;
    private final AttributeCatalogFetcher catalogFetcher;
    private final PipelineParser pipelineParser;
    private final PipelineQueryValidator validator;
    private final FilterPipelines filterPipelines;
    private final QueryRequestBuilder requestBuilder;
    private final TelemetryBackendClient backendClient;
    private final ResponseNormalizer normalizer;
    private final PrometheusQueryService prometheusQueryService;
    private final int defaultLookbackMinutes;

    public TelemetryQueryService(TimeRangeResolver timeRangeResolver, SessionContext sessionContext,
                                 AttributeCatalogFetcher catalogFetcher, PipelineParser pipelineParser,
                                 PipelineQueryValidator validator, FilterPipelines filterPipelines,
                                 QueryRequestBuilder requestBuilder, TelemetryBackendClient backendClient,
                                 ResponseNormalizer normalizer, PrometheusQueryService prometheusQueryService,
                                 Last9Properties properties) {
        this.timeRangeResolver = timeRangeResolver;
        this.sessionContext = sessionContext;
        this.catalogFetcher = catalogFetcher;
        this.pipelineParser = pipelineParser;
        this.validator = validator;
        this.filterPipelines = filterPipelines;
        this.requestBuilder = requestBuilder;
        this.backendClient = backendClient;
        this.normalizer = normalizer;
        this.prometheusQueryService = prometheusQueryService;
        this.defaultLookbackMinutes = properties.getQuery().getDefaultLookbackMinutes();
    }

    public TimeRange resolveTimeRange(TimeRangeParams params, int defaultLookback) {
        return timeRangeResolver.resolve(params, defaultLookback);
    }

    /**
     * Fetch the attribute catalog for a window, failing if discovery fails
     */
    public AttributeCatalog fetchCatalog(TelemetrySignal signal, TimeRange range) {
        return catalogFetcher.fetch(signal, range, null);
    }

    /**
     * Validate and execute a free-form log pipeline
     */
    public QueryOutcome<LogRecord> validateAndRunLogs(String pipelineJson, TimeRangeParams params, Integer limit) {
        int effectiveLimit = requestBuilder.resolveLimit(limit, requestBuilder.defaultLimit(QueryOptions.LimitScope.GENERAL));
        List<String> warnings = new ArrayList<>();
        TimeRange range = timeRangeResolver.resolve(params, defaultLookbackMinutes);
        JsonNode response = validateAndExecute(TelemetrySignal.LOGS, pipelineJson, range, limit, warnings);
        return new QueryOutcome<>(normalizer.normalizeLogs(response, null, effectiveLimit), warnings, range);
    }

    /**
     * Validate and execute a free-form trace pipeline
     */
    public QueryOutcome<TraceRecord> validateAndRunTraces(String pipelineJson, TimeRangeParams params, Integer limit) {
        List<String> warnings = new ArrayList<>();
        TimeRange range = timeRangeResolver.resolve(params, defaultLookbackMinutes);
        JsonNode response = validateAndExecute(TelemetrySignal.TRACES, pipelineJson, range, limit, warnings);
        return new QueryOutcome<>(normalizer.normalizeTraces(response), warnings, range);
    }

    /**
     * Raw log lines for one service, with optional severity and body patterns
     */
    public QueryOutcome<LogRecord> serviceLogs(String serviceName, List<String> severityFilters, List<String> bodyFilters,
                                               String environment, TimeRangeParams params, Integer limit) {
        requireService(serviceName);
        List<String> warnings = new ArrayList<>();
        TimeRange range = timeRangeResolver.resolve(params, defaultLookbackMinutes);
        Pipeline pipeline = pipelineParser.parse(filterPipelines.serviceLogs(serviceName, severityFilters, bodyFilters));

        QueryOptions options = QueryOptions.limit(limit);
        Optional<String> index = physicalIndexHint(serviceName, environment, warnings);
        if (index.isPresent()) {
            options = options.withIndex(index.get());
        }

        JsonNode response = execute(TelemetrySignal.LOGS, pipeline, range, options);
        int effectiveLimit = requestBuilder.resolveLimit(limit, requestBuilder.defaultLimit(QueryOptions.LimitScope.GENERAL));
        return new QueryOutcome<>(normalizer.normalizeLogs(response, serviceName, effectiveLimit), warnings, range);
    }

    /**
     * Spans for one service. Defaults: 10 results ordered by Duration, backward.
     */
    public QueryOutcome<TraceRecord> serviceTraces(String serviceName, List<String> spanKinds, String spanName,
                                                   List<String> statusCodes, String environment, String order,
                                                   String direction, TimeRangeParams params, Integer limit) {
        requireService(serviceName);
        TimeRange range = timeRangeResolver.resolve(params, defaultLookbackMinutes);
        Pipeline pipeline = pipelineParser.parse(
                filterPipelines.serviceTraces(serviceName, spanKinds, spanName, statusCodes, environment));
        QueryOptions options = new QueryOptions(limit, QueryOptions.LimitScope.SERVICE_TRACES,
                StringUtils.hasText(order) ? order : SERVICE_TRACES_ORDER, direction, null);

        JsonNode response = execute(TelemetrySignal.TRACES, pipeline, range, options);
        return new QueryOutcome<>(normalizer.normalizeTraces(response), List.of(), range);
    }

    /**
     * Spans that recorded an exception, promoted to exception records
     */
    public QueryOutcome<ExceptionRecord> exceptions(String serviceName, String spanName, String environment,
                                                    TimeRangeParams params, Integer limit) {
        TimeRange range = timeRangeResolver.resolve(params, defaultLookbackMinutes);
        Pipeline pipeline = pipelineParser.parse(filterPipelines.exceptions(serviceName, spanName, environment));

        JsonNode response = execute(TelemetrySignal.TRACES, pipeline, range, QueryOptions.limit(limit));
        return new QueryOutcome<>(normalizer.normalizeExceptions(response), List.of(), range);
    }

    private JsonNode validateAndExecute(TelemetrySignal signal, String pipelineJson, TimeRange range,
                                        Integer limit, List<String> warnings) {
        Pipeline pipeline = pipelineParser.parse(pipelineJson);

        AttributeCatalog catalog;
        if (signal == TelemetrySignal.LOGS) {
            catalog = catalogFetcher.fetchLenient(signal, range, null);
            catalog.getWarning().ifPresent(warnings::add);
        } else {
            catalog = catalogFetcher.fetch(signal, range, null);
        }
        validator.validate(signal, pipeline, catalog);

        return execute(signal, pipeline, range, QueryOptions.limit(limit));
    }

    private JsonNode execute(TelemetrySignal signal, Pipeline pipeline, TimeRange range, QueryOptions options) {
        BackendRequest request = requestBuilder.pipelineQuery(signal, pipeline, range, options, sessionContext.resolveTenant(false));
        log.info("Executing {} query over {} - {}", signal.getLabel(), range.start(), range.end());
        return backendClient.execute(request);
    }

    private Optional<String> physicalIndexHint(String serviceName, String environment, List<String> warnings) {
        try {
            return prometheusQueryService.physicalIndex(serviceName, environment);
        } catch (TelemetryException e) {
            log.warn("Physical index lookup for {} failed, querying without index: {}", serviceName, e.getMessage());
            warnings.add("physical index lookup failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    private static void requireService(String serviceName) {
        if (!StringUtils.hasText(serviceName)) {
            throw new ValidationException("service name is required");
        }
    }
}
