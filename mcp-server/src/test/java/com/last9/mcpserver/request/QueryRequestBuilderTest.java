package com.last9.mcpserver.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.mcpserver.TestFixtures;
import com.last9.mcpserver.query.PipelineParser;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.mcpserver.session.SessionSnapshot;
import com.last9.mcpserver.time.TimeRange;
import com.last9.shared.telemetry.exception.ValidationException;
import com.last9.shared.telemetry.model.TelemetrySignal;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryRequestBuilderTest {

    private static final Instant START = Instant.parse("2024-06-01T10:00:00Z");
    private static final TimeRange RANGE = new TimeRange(START, START.plusSeconds(3600));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueryRequestBuilder builder = new QueryRequestBuilder(objectMapper, TestFixtures.properties());
    private final PipelineParser parser = new PipelineParser(objectMapper);
    private final SessionSnapshot session = TestFixtures.session();

    @Test
    void limitPolicy() {
        assertThat(builder.resolveLimit(null, 20)).isEqualTo(20);
        assertThat(builder.resolveLimit(0, 20)).isEqualTo(20);
        assertThat(builder.resolveLimit(-3, 10)).isEqualTo(10);
        assertThat(builder.resolveLimit(50, 20)).isEqualTo(50);
        assertThat(builder.resolveLimit(500, 20)).isEqualTo(100);
    }

    @Test
    void defaultLimitDependsOnScope() {
        assertThat(builder.defaultLimit(QueryOptions.LimitScope.GENERAL)).isEqualTo(20);
        assertThat(builder.defaultLimit(QueryOptions.LimitScope.SERVICE_TRACES)).isEqualTo(10);
    }

    @Test
    void tracePipelineQueryCarriesWindowInSecondsAndPipelineBody() {
        Pipeline pipeline = parser.parse("[{\"type\":\"filter\",\"query\":{\"$eq\":[\"ServiceName\",\"api\"]}}]");

        BackendRequest request = builder.pipelineQuery(TelemetrySignal.TRACES, pipeline, RANGE,
                QueryOptions.limit(10), session);

        assertThat(request.endpoint()).isEqualTo(BackendEndpoint.TRACES_QUERY_RANGE);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.uri().toString()).startsWith(TestFixtures.API_BASE_URL + "/cat/api/traces/v2/query_range/json?");
        Map<String, String> params = UriComponentsBuilder.fromUri(request.uri()).build().getQueryParams().toSingleValueMap();
        assertThat(params)
                .containsEntry("region", "ap-south-1")
                .containsEntry("start", String.valueOf(START.getEpochSecond()))
                .containsEntry("end", String.valueOf(START.getEpochSecond() + 3600))
                .containsEntry("limit", "10")
                .containsEntry("order", "Timestamp")
                .containsEntry("direction", "backward")
                .doesNotContainKey("index");
        assertThat(request.body().get("pipeline")).isEqualTo(pipeline.toJson());
    }

    @Test
    void physicalIndexAddsIndexType() {
        Pipeline pipeline = parser.parse("[]");

        BackendRequest request = builder.pipelineQuery(TelemetrySignal.LOGS, pipeline, RANGE,
                QueryOptions.limit(500).withIndex("physical_index:payments"), session);

        Map<String, String> params = UriComponentsBuilder.fromUri(request.uri()).build().getQueryParams().toSingleValueMap();
        assertThat(request.endpoint()).isEqualTo(BackendEndpoint.LOGS_QUERY_RANGE);
        assertThat(params).containsEntry("limit", "100").containsEntry("index_type", "physical");
        assertThat(request.uri().getQuery()).contains("index=physical_index:payments");
    }

    @Test
    void authHeadersCarryBothTokenForms() {
        HttpHeaders headers = builder.authHeaders("tok");

        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer tok");
        assertThat(headers.getFirst(QueryRequestBuilder.HEADER_API_TOKEN)).isEqualTo("Bearer tok");
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("Last9-MCP-Server/1.0");
        assertThat(headers.getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/json");
    }

    @Test
    void promRangeQueryBody() {
        BackendRequest request = builder.promRangeQuery("up", RANGE, session);

        JsonNode body = request.body();
        assertThat(request.uri().toString()).isEqualTo(TestFixtures.API_BASE_URL + "/prom_query");
        assertThat(body.get("query").asText()).isEqualTo("up");
        assertThat(body.get("timestamp").asLong()).isEqualTo(START.getEpochSecond());
        assertThat(body.get("window").asLong()).isEqualTo(3600);
        assertThat(body.get("read_url").asText()).isEqualTo("https://read.example.com/prom");
        assertThat(body.get("username").asText()).isEqualTo("reader");
        assertThat(body.get("password").asText()).isEqualTo("s3cret");
    }

    @Test
    void promLabelValuesIncludesMatchers() {
        BackendRequest request = builder.promLabelValues("service", "up{job=\"api\"}", RANGE, session);

        assertThat(request.body().get("label").asText()).isEqualTo("service");
        assertThat(request.body().get("matches")).hasSize(1);
        assertThat(request.body().get("matches").get(0).asText()).isEqualTo("up{job=\"api\"}");
    }

    @Test
    void promLabelsPostsSelectorAsMetric() {
        BackendRequest request = builder.promLabels("up{job=\"api\"}", RANGE, session);

        assertThat(request.uri().toString()).isEqualTo(TestFixtures.API_BASE_URL + "/apm/labels");
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.body().get("metric").asText()).isEqualTo("up{job=\"api\"}");
        assertThat(request.body().get("window").asLong()).isEqualTo(RANGE.duration().getSeconds());
        assertThat(request.body().get("read_url").asText()).isEqualTo("https://read.example.com/prom");
    }

    @Test
    void promQueriesRequireDatasource() {
        SessionSnapshot noDatasource = new SessionSnapshot("t", null, null, "acme", null,
                TestFixtures.API_BASE_URL, null);

        assertThatThrownBy(() -> builder.promInstantQuery("up", START, noDatasource))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void tokenExchangeStripsTrailingApi() {
        BackendRequest request = builder.tokenExchange("https://otlp.example.com/api", "refresh");

        assertThat(request.uri().toString()).isEqualTo("https://otlp.example.com/api/v4/oauth/access_token");
        assertThat(request.body().get("refresh_token").asText()).isEqualTo("refresh");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isNull();
    }

    @Test
    void datasourcesIsPlainGet() {
        BackendRequest request = builder.datasources(TestFixtures.API_BASE_URL, "tok");

        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.body()).isNull();
        assertThat(request.uri().toString()).isEqualTo(TestFixtures.API_BASE_URL + "/datasources");
        assertThat(request.headers().getFirst(QueryRequestBuilder.HEADER_API_TOKEN)).isEqualTo("Bearer tok");
    }
}
