package com.last9.mcpserver.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.mcpserver.request.BackendEndpoint;
import com.last9.mcpserver.request.BackendRequest;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.mcpserver.session.SessionContext;
import com.last9.mcpserver.session.SessionSnapshot;
import com.last9.mcpserver.time.TimeRange;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.exception.TelemetryException;
import com.last9.shared.telemetry.model.TelemetrySignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Service for discovering the attribute names present in a tenant's logs or traces
 *
 * Logs use a sampling series query for short windows and the pre-aggregated labels index for
 * windows longer than the configured threshold (20 minutes). Traces always use the series
 * query with an empty filter.
 */
@Service
@Slf4j
public class AttributeCatalogFetcher {

    private final SessionContext sessionContext;
    private final QueryRequestBuilder requestBuilder;
    private final TelemetryBackendClient backendClient;
    private final ObjectMapper objectMapper;
    private final int labelsThresholdMinutes;

    public AttributeCatalogFetcher(SessionContext sessionContext, QueryRequestBuilder requestBuilder,
                                   TelemetryBackendClient backendClient, ObjectMapper objectMapper,
                                   Last9Properties properties) {
        this.sessionContext = sessionContext;
        this.requestBuilder = requestBuilder;
        this.backendClient = backendClient;
        this.objectMapper = objectMapper;
        this.labelsThresholdMinutes = properties.getQuery().getLabelsThresholdMinutes();
    }

    /**
     * Fetch the catalog, failing the call if discovery fails
     *
     * @param region backend region, the session region when blank
     */
    public AttributeCatalog fetch(TelemetrySignal signal, TimeRange range, String region) {
        SessionSnapshot session = sessionContext.snapshot();
        String effectiveRegion = StringUtils.hasText(region) ? region : session.region();
        BackendRequest request = buildProbe(signal, range, effectiveRegion, session);

        JsonNode response = backendClient.execute(request);
        String status = response.path("status").asText("");
        if (!"success".equals(status)) {
            throw new DecodeException(String.format("%s returned non-success status: %s",
                    request.endpoint().getPath(), status));
        }

        List<String> names = request.endpoint() == BackendEndpoint.LOGS_LABELS
                ? labelNames(response.path("data"))
                : seriesKeys(response.path("data"));
        AttributeCatalog catalog = AttributeCatalog.of(names);
        log.debug("Fetched {} {} attributes via {}", catalog.getNames().size(), signal.getLabel(),
                request.endpoint().getPath());
        return catalog;
    }

    /**
     * Fetch the catalog, degrading to an empty catalog with a warning if discovery fails
     */
    public AttributeCatalog fetchLenient(TelemetrySignal signal, TimeRange range, String region) {
        try {
            return fetch(signal, range, region);
        } catch (TelemetryException e) {
            log.warn("Attribute discovery for {} failed, continuing without catalog: {}", signal.getLabel(), e.getMessage());
            return AttributeCatalog.unavailable("attribute discovery failed: " + e.getMessage());
        }
    }

    BackendRequest buildProbe(TelemetrySignal signal, TimeRange range, String region, SessionSnapshot session) {
        if (signal == TelemetrySignal.TRACES) {
            return requestBuilder.catalogProbe(BackendEndpoint.TRACES_SERIES, range, region, emptyFilterBody(), session);
        }
        // whole minutes, as the backend counts them
        long minutes = range.duration().getSeconds() / 60;
        if (minutes > labelsThresholdMinutes) {
            return requestBuilder.catalogProbe(BackendEndpoint.LOGS_LABELS, range, region, null, session);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("pipeline");
        return requestBuilder.catalogProbe(BackendEndpoint.LOGS_SERIES, range, region, body, session);
    }

    private ObjectNode emptyFilterBody() {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode pipeline = body.putArray("pipeline");
        ObjectNode stage = pipeline.addObject();
        stage.putObject("query").putArray("$and");
        stage.put("type", "filter");
        return body;
    }

    private static List<String> labelNames(JsonNode data) {
        List<String> names = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode label : data) {
                if (label.isTextual()) {
                    names.add(label.asText());
                }
            }
        }
        return names;
    }

    private static List<String> seriesKeys(JsonNode data) {
        List<String> names = new ArrayList<>();
        if (data.isArray() && data.size() > 0 && data.get(0).isObject()) {
            Iterator<String> it = data.get(0).fieldNames();
            it.forEachRemaining(names::add);
        }
        return names;
    }
}
