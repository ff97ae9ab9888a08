package com.last9.mcpserver.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.mcpserver.catalog.AttributeCatalog;
import com.last9.mcpserver.catalog.AttributeCatalogFetcher;
import com.last9.mcpserver.service.PrometheusQueryService;
import com.last9.mcpserver.service.QueryOutcome;
import com.last9.mcpserver.service.TelemetryQueryService;
import com.last9.mcpserver.time.TimeRange;
import com.last9.mcpserver.time.TimeRangeParams;
import com.last9.shared.telemetry.exception.UpstreamException;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.LogRecord;
import com.last9.shared.telemetry.model.TelemetrySignal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelemetryToolServiceTest {

    private static final TimeRange RANGE =
            new TimeRange(Instant.parse("2024-06-01T10:00:00Z"), Instant.parse("2024-06-01T11:00:00Z"));

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private TelemetryQueryService telemetryQueryService;

    @Mock
    private AttributeCatalogFetcher attributeCatalogFetcher;

    @Mock
    private PrometheusQueryService prometheusQueryService;

    @InjectMocks
    private TelemetryToolService toolService;

    @Test
    void logsResponseCarriesRecordsAndWarnings() throws Exception {
        when(telemetryQueryService.validateAndRunLogs(eq("[]"), any(TimeRangeParams.class), eq(5)))
                .thenReturn(new QueryOutcome<>(List.of(new LogRecord("api", "2024-06-01T10:00:00Z", "hi", "info")),
                        List.of("attribute discovery failed: timeout"), RANGE));

        JsonNode response = objectMapper.readTree(toolService.getLogs("[]", null, null, null, 5));

        assertThat(response.get("status").asText()).isEqualTo("success");
        assertThat(response.get("start").asText()).isEqualTo("2024-06-01T10:00:00Z");
        assertThat(response.get("count").asInt()).isEqualTo(1);
        assertThat(response.get("warnings").get(0).asText()).isEqualTo("attribute discovery failed: timeout");
        assertThat(response.get("records").get(0).get("service").asText()).isEqualTo("api");
        assertThat(response.get("records").get(0).get("severity").asText()).isEqualTo("info");
    }

    @Test
    void validationFailureBecomesErrorPayload() throws Exception {
        when(telemetryQueryService.validateAndRunTraces(any(), any(), any()))
                .thenThrow(new ValidationException("trace query uses unsupported fields: foo"));

        JsonNode response = objectMapper.readTree(toolService.getTraces("[]", 30, null, null, null));

        assertThat(response.get("status").asText()).isEqualTo("error");
        assertThat(response.get("kind").asText()).isEqualTo("VALIDATION");
        assertThat(response.get("error").asText()).isEqualTo("Failed to query traces");
        assertThat(response.get("message").asText()).isEqualTo("trace query uses unsupported fields: foo");
        assertThat(response.has("context")).isFalse();
    }

    @Test
    void upstreamFailureKeepsStatusContext() throws Exception {
        when(telemetryQueryService.resolveTimeRange(any(), eq(15))).thenReturn(RANGE);
        when(attributeCatalogFetcher.fetch(TelemetrySignal.TRACES, RANGE, null))
                .thenThrow(new UpstreamException("/cat/api/traces/v2/series/json", 502, "bad gateway"));

        JsonNode response = objectMapper.readTree(toolService.getTraceAttributes(null, null, null, null));

        assertThat(response.get("kind").asText()).isEqualTo("UPSTREAM");
        assertThat(response.get("context").get("status").asInt()).isEqualTo(502);
    }

    @Test
    void unexpectedFailureIsInternal() throws Exception {
        when(telemetryQueryService.exceptions(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("boom"));

        JsonNode response = objectMapper.readTree(toolService.getExceptions(null, null, null, null, null, null, null));

        assertThat(response.get("kind").asText()).isEqualTo("INTERNAL");
        assertThat(response.get("message").asText()).isEqualTo("boom");
    }

    @Test
    void logAttributesSplitResourceNames() throws Exception {
        when(telemetryQueryService.resolveTimeRange(any(), eq(15))).thenReturn(RANGE);
        when(attributeCatalogFetcher.fetchLenient(TelemetrySignal.LOGS, RANGE, "eu"))
                .thenReturn(AttributeCatalog.of(List.of("level", "resource_host.name")));

        JsonNode response = objectMapper.readTree(toolService.getLogAttributes(null, null, null, "eu"));

        assertThat(response.get("count").asInt()).isEqualTo(2);
        assertThat(response.get("log_attributes").get(0).asText()).isEqualTo("level");
        assertThat(response.get("resource_attributes").get(0).asText()).isEqualTo("resource_host.name");
        assertThat(response.has("warnings")).isFalse();
    }

    @Test
    void instantQueryRequiresExpression() throws Exception {
        JsonNode response = objectMapper.readTree(toolService.prometheusInstantQuery(" ", null));

        assertThat(response.get("kind").asText()).isEqualTo("VALIDATION");
        assertThat(response.get("message").asText()).isEqualTo("query is required");
        verifyNoInteractions(prometheusQueryService);
    }

    @Test
    void instantQueryParsesTime() throws Exception {
        when(prometheusQueryService.instantQuery("up", Instant.parse("2024-06-01T10:00:00Z")))
                .thenReturn(objectMapper.readTree("[{\"value\":[1717236000,\"1\"]}]"));

        String response = toolService.prometheusInstantQuery("up", "2024-06-01 10:00:00");

        assertThat(response).isEqualTo("[{\"value\":[1717236000,\"1\"]}]");
    }

    @Test
    void labelValuesDefaultToOneHour() throws Exception {
        when(telemetryQueryService.resolveTimeRange(any(), eq(60))).thenReturn(RANGE);
        when(prometheusQueryService.labelValues(eq("service"), isNull(), eq(RANGE)))
                .thenReturn(objectMapper.readTree("[\"api\",\"web\"]"));

        assertThat(toolService.prometheusLabelValues(null, "service", null, null, null)).isEqualTo("[\"api\",\"web\"]");
    }

    @Test
    void serviceEnvironmentsDefaultToOneHour() throws Exception {
        when(telemetryQueryService.resolveTimeRange(any(), eq(60))).thenReturn(RANGE);
        when(prometheusQueryService.serviceEnvironments(RANGE)).thenReturn(objectMapper.readTree("[\"prod\"]"));

        assertThat(toolService.getServiceEnvironments(null, null, null)).isEqualTo("[\"prod\"]");
    }

    @Test
    void labelsRequireMatchQuery() throws Exception {
        JsonNode response = objectMapper.readTree(toolService.prometheusLabels("", null, null, null));

        assertThat(response.get("kind").asText()).isEqualTo("VALIDATION");
        assertThat(response.get("message").asText()).isEqualTo("match_query is required");
        verifyNoInteractions(prometheusQueryService);
    }

    @Test
    void labelsPassSelectorThrough() throws Exception {
        when(telemetryQueryService.resolveTimeRange(any(), eq(60))).thenReturn(RANGE);
        when(prometheusQueryService.labels("up{job=\"api\"}", RANGE))
                .thenReturn(objectMapper.readTree("[\"__name__\",\"job\"]"));

        assertThat(toolService.prometheusLabels("up{job=\"api\"}", null, null, null))
                .isEqualTo("[\"__name__\",\"job\"]");
    }
}
