package com.last9.mcpserver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.mcpserver.session.SessionContext;
import com.last9.mcpserver.time.TimeRange;
import com.last9.shared.telemetry.exception.DecodeException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Service for PromQL passthrough against the tenant's metrics datasource
 */
@Service
@Log4j2
public class PrometheusQueryService {

    static final String SERVER_SPAN_SELECTOR = "domain_attributes_count{span_kind='SPAN_KIND_SERVER'}";

    private final SessionContext sessionContext;
    private final QueryRequestBuilder requestBuilder;
    private final TelemetryBackendClient backendClient;
    private final Clock clock;

    public PrometheusQueryService(SessionContext sessionContext, QueryRequestBuilder requestBuilder,
                                  TelemetryBackendClient backendClient, Clock clock) {
        this.sessionContext = sessionContext;
        this.requestBuilder = requestBuilder;
        this.backendClient = backendClient;
        this.clock = clock;
    }

    public JsonNode rangeQuery(String query, TimeRange range) {
        log.info("PromQL range query over {} - {}: {}", range.start(), range.end(), query);
        return backendClient.execute(requestBuilder.promRangeQuery(query, range, sessionContext.resolveTenant(false)));
    }

    /**
     * @param time evaluation instant, now when null
     */
    public JsonNode instantQuery(String query, Instant time) {
        Instant at = time != null ? time : clock.instant();
        log.info("PromQL instant query at {}: {}", at, query);
        return backendClient.execute(requestBuilder.promInstantQuery(query, at, sessionContext.resolveTenant(false)));
    }

    public JsonNode labelValues(String label, String match, TimeRange range) {
        log.info("Label values for '{}' matching '{}'", label, match);
        return backendClient.execute(requestBuilder.promLabelValues(label, match, range, sessionContext.resolveTenant(false)));
    }

    public JsonNode labels(String match, TimeRange range) {
        log.info("Label names matching '{}'", match);
        return backendClient.execute(requestBuilder.promLabels(match, range, sessionContext.resolveTenant(false)));
    }

    /**
     * Environments reporting server spans in the window.
     */
    public JsonNode serviceEnvironments(TimeRange range) {
        return labelValues("env", SERVER_SPAN_SELECTOR, range);
    }

    /**
     * Look up the physical log index serving a service, e.g. {@code physical_index:payments}.
     *
     * @return empty when the metric has no series for the service
     */
    public Optional<String> physicalIndex(String serviceName, String environment) {
        StringBuilder query = new StringBuilder("sum by (name, destination) (physical_index_service_count{service_name='")
                .append(escape(serviceName)).append('\'');
        if (StringUtils.hasText(environment)) {
            query.append(",env=~'").append(escape(environment)).append('\'');
        }
        query.append("}[1d])");

        JsonNode response = instantQuery(query.toString(), null);
        if (!response.isArray()) {
            throw new DecodeException("physical index response is not an array");
        }
        if (response.isEmpty()) {
            return Optional.empty();
        }
        JsonNode name = response.get(0).path("metric").path("name");
        if (!name.isTextual() || name.asText().isEmpty()) {
            throw new DecodeException("no index name found in physical index response");
        }
        return Optional.of(QueryRequestBuilder.PHYSICAL_INDEX_PREFIX + name.asText());
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
