package com.last9.mcpserver.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.mcpserver.session.Datasource;
import com.last9.mcpserver.session.SessionSnapshot;
import com.last9.mcpserver.time.TimeRange;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.TelemetrySignal;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Turns pipelines, windows and limits into backend requests.
 *
 * All epoch conversions happen here, using the unit declared by each {@link BackendEndpoint}.
 */
@Component
@Log4j2
public class QueryRequestBuilder {

    public static final String HEADER_API_TOKEN = "X-LAST9-API-TOKEN";
    public static final String BEARER_PREFIX = "Bearer ";
    public static final String PHYSICAL_INDEX_PREFIX = "physical_index:";

    private static final String DEFAULT_ORDER = "Timestamp";
    private static final String DEFAULT_DIRECTION = "backward";

    private final ObjectMapper objectMapper;
    private final Last9Properties properties;

    public QueryRequestBuilder(ObjectMapper objectMapper, Last9Properties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Build a query_range call for a validated pipeline
     */
    public BackendRequest pipelineQuery(TelemetrySignal signal, Pipeline pipeline, TimeRange range,
                                        QueryOptions options, SessionSnapshot session) {
        BackendEndpoint endpoint = signal == TelemetrySignal.LOGS
                ? BackendEndpoint.LOGS_QUERY_RANGE : BackendEndpoint.TRACES_QUERY_RANGE;
        QueryOptions opts = options != null ? options : QueryOptions.limit(null);
        int limit = resolveLimit(opts.limit(), defaultLimit(opts.scope()));
        EpochUnit unit = endpoint.getTimeUnit();

        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(session.apiBaseUrl() + endpoint.getPath())
                .queryParam("region", session.region())
                .queryParam("start", unit.fromInstant(range.start()))
                .queryParam("end", unit.fromInstant(range.end()))
                .queryParam("limit", limit)
                .queryParam("order", StringUtils.hasText(opts.order()) ? opts.order() : DEFAULT_ORDER)
                .queryParam("direction", StringUtils.hasText(opts.direction()) ? opts.direction() : DEFAULT_DIRECTION);
        if (StringUtils.hasText(opts.index())) {
            uri.queryParam("index", opts.index());
            if (opts.index().startsWith(PHYSICAL_INDEX_PREFIX)) {
                uri.queryParam("index_type", "physical");
            }
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.set("pipeline", pipeline.toJson());

        log.debug("Built {} query: limit={}, window={} - {}", signal.getLabel(), limit, range.start(), range.end());
        return new BackendRequest(endpoint, endpoint.getMethod(), toUri(uri), authHeaders(session.accessToken()), body);
    }

    /**
     * Apply the limit policy: unset, zero or negative uses the default; above the maximum is
     * clamped, never rejected.
     */
    public int resolveLimit(Integer requested, int defaultLimit) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, properties.getQuery().getMaxLimit());
    }

    public int defaultLimit(QueryOptions.LimitScope scope) {
        return scope == QueryOptions.LimitScope.SERVICE_TRACES
                ? properties.getQuery().getDefaultServiceTraceLimit()
                : properties.getQuery().getDefaultLimit();
    }

    /**
     * Build an attribute discovery call. GET endpoints carry no body.
     */
    public BackendRequest catalogProbe(BackendEndpoint endpoint, TimeRange range, String region,
                                       JsonNode body, SessionSnapshot session) {
        EpochUnit unit = endpoint.getTimeUnit();
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(session.apiBaseUrl() + endpoint.getPath())
                .queryParam("region", region)
                .queryParam("start", unit.fromInstant(range.start()))
                .queryParam("end", unit.fromInstant(range.end()));
        return new BackendRequest(endpoint, endpoint.getMethod(), toUri(uri), authHeaders(session.accessToken()), body);
    }

    public BackendRequest promRangeQuery(String query, TimeRange range, SessionSnapshot session) {
        BackendEndpoint endpoint = BackendEndpoint.PROM_QUERY;
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        putWindow(body, endpoint.getTimeUnit(), range);
        putDatasource(body, session);
        return promRequest(endpoint, body, session);
    }

    public BackendRequest promInstantQuery(String query, Instant time, SessionSnapshot session) {
        BackendEndpoint endpoint = BackendEndpoint.PROM_QUERY_INSTANT;
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        body.put("timestamp", endpoint.getTimeUnit().fromInstant(time));
        putDatasource(body, session);
        return promRequest(endpoint, body, session);
    }

    public BackendRequest promLabelValues(String label, String match, TimeRange range, SessionSnapshot session) {
        BackendEndpoint endpoint = BackendEndpoint.PROM_LABEL_VALUES;
        ObjectNode body = objectMapper.createObjectNode();
        body.put("label", label);
        putWindow(body, endpoint.getTimeUnit(), range);
        putDatasource(body, session);
        ArrayNode matches = body.putArray("matches");
        if (StringUtils.hasText(match)) {
            matches.add(match);
        }
        return promRequest(endpoint, body, session);
    }

    /**
     * Build a label names request. The series selector travels as {@code metric}.
     */
    public BackendRequest promLabels(String match, TimeRange range, SessionSnapshot session) {
        BackendEndpoint endpoint = BackendEndpoint.PROM_LABELS;
        ObjectNode body = objectMapper.createObjectNode();
        putWindow(body, endpoint.getTimeUnit(), range);
        putDatasource(body, session);
        body.put("metric", match);
        return promRequest(endpoint, body, session);
    }

    public BackendRequest datasources(String apiBaseUrl, String accessToken) {
        BackendEndpoint endpoint = BackendEndpoint.DATASOURCES;
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HEADER_API_TOKEN, BEARER_PREFIX + accessToken);
        headers.set(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent());
        URI uri = toUri(UriComponentsBuilder.fromUriString(apiBaseUrl + endpoint.getPath()));
        return new BackendRequest(endpoint, endpoint.getMethod(), uri, headers, null);
    }

    /**
     * Build the refresh token exchange. A trailing /api on the action URL is dropped before the
     * OAuth path is appended.
     */
    public BackendRequest tokenExchange(String actionUrl, String refreshToken) {
        BackendEndpoint endpoint = BackendEndpoint.OAUTH_ACCESS_TOKEN;
        String base = actionUrl.endsWith("/api") ? actionUrl.substring(0, actionUrl.length() - 4) : actionUrl;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent());
        ObjectNode body = objectMapper.createObjectNode();
        body.put("refresh_token", refreshToken);
        URI uri = toUri(UriComponentsBuilder.fromUriString(base + endpoint.getPath()));
        return new BackendRequest(endpoint, endpoint.getMethod(), uri, headers, body);
    }

    HttpHeaders authHeaders(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, BEARER_PREFIX + accessToken);
        headers.set(HEADER_API_TOKEN, BEARER_PREFIX + accessToken);
        headers.set(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent());
        return headers;
    }

    private BackendRequest promRequest(BackendEndpoint endpoint, ObjectNode body, SessionSnapshot session) {
        URI uri = toUri(UriComponentsBuilder.fromUriString(session.apiBaseUrl() + endpoint.getPath()));
        return new BackendRequest(endpoint, endpoint.getMethod(), uri, authHeaders(session.accessToken()), body);
    }

    private static void putWindow(ObjectNode body, EpochUnit unit, TimeRange range) {
        long start = unit.fromInstant(range.start());
        body.put("timestamp", start);
        body.put("window", unit.fromInstant(range.end()) - start);
    }

    private static void putDatasource(ObjectNode body, SessionSnapshot session) {
        Datasource ds = session.datasource();
        if (ds == null) {
            throw new ValidationException("no metrics datasource resolved for this session");
        }
        body.put("read_url", ds.readUrl());
        body.put("username", ds.username());
        body.put("password", ds.password());
    }

    private static URI toUri(UriComponentsBuilder builder) {
        return builder.encode().build().toUri();
    }
}
