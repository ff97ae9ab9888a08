package com.last9.mcpserver.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.exception.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Lists the tenant's datasources and picks the one the session uses for metrics and region.
 */
@Component
@Log4j2
public class DatasourceResolver {

    private final QueryRequestBuilder requestBuilder;
    private final TelemetryBackendClient backendClient;

    public DatasourceResolver(QueryRequestBuilder requestBuilder, TelemetryBackendClient backendClient) {
        this.requestBuilder = requestBuilder;
        this.backendClient = backendClient;
    }

    /**
     * Select by name when {@code datasourceName} is set, otherwise the entry flagged default.
     *
     * @throws ValidationException if no entry matches or the match lacks url, credentials or region
     */
    public Datasource resolve(String apiBaseUrl, String accessToken, String datasourceName) {
        JsonNode list = backendClient.execute(requestBuilder.datasources(apiBaseUrl, accessToken));
        if (!list.isArray()) {
            throw new DecodeException("datasources response is not an array");
        }

        JsonNode selected = null;
        if (StringUtils.hasText(datasourceName)) {
            for (JsonNode entry : list) {
                if (datasourceName.equals(entry.path("name").asText())) {
                    selected = entry;
                    break;
                }
            }
            if (selected == null) {
                throw new ValidationException(String.format("datasource with name '%s' not found", datasourceName));
            }
        } else {
            for (JsonNode entry : list) {
                if (entry.path("is_default").asBoolean(false)) {
                    selected = entry;
                    break;
                }
            }
            if (selected == null) {
                throw new ValidationException("default datasource not found");
            }
        }

        Datasource ds = new Datasource(
                selected.path("name").asText(""),
                selected.path("url").asText(""),
                selected.path("region").asText(""),
                selected.path("properties").path("username").asText(""),
                selected.path("properties").path("password").asText(""));
        if (ds.readUrl().isEmpty() || ds.username().isEmpty() || ds.password().isEmpty() || ds.region().isEmpty()) {
            throw new ValidationException("selected datasource missing required properties");
        }
        log.info("Selected datasource '{}' in region {}", ds.name(), ds.region());
        return ds;
    }
}
