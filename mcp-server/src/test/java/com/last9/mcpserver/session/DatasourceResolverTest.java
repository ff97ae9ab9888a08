package com.last9.mcpserver.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.mcpserver.TestFixtures;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DatasourceResolverTest {

    private static final String URL = TestFixtures.API_BASE_URL + "/datasources";
    private static final String LIST = """
            [
              {"name":"staging","url":"https://staging/prom","region":"us-east-1","is_default":false,
               "properties":{"username":"su","password":"sp"}},
              {"name":"prod","url":"https://prod/prom","region":"ap-south-1","is_default":true,
               "properties":{"username":"pu","password":"pp"}},
              {"name":"broken","url":"https://broken/prom","region":"","is_default":false,
               "properties":{"username":"bu"}}
            ]
            """;

    private MockRestServiceServer server;
    private DatasourceResolver resolver;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        resolver = new DatasourceResolver(new QueryRequestBuilder(objectMapper, TestFixtures.properties()),
                new TelemetryBackendClient(restTemplate, objectMapper));
    }

    @Test
    void picksDefaultWhenNoNameConfigured() {
        server.expect(requestTo(URL)).andRespond(withSuccess(LIST, MediaType.APPLICATION_JSON));

        Datasource ds = resolver.resolve(TestFixtures.API_BASE_URL, "tok", null);

        assertThat(ds.name()).isEqualTo("prod");
        assertThat(ds.readUrl()).isEqualTo("https://prod/prom");
        assertThat(ds.region()).isEqualTo("ap-south-1");
        assertThat(ds.username()).isEqualTo("pu");
        assertThat(ds.password()).isEqualTo("pp");
        assertThat(ds.toString()).doesNotContain("pp");
    }

    @Test
    void picksByName() {
        server.expect(requestTo(URL)).andRespond(withSuccess(LIST, MediaType.APPLICATION_JSON));

        assertThat(resolver.resolve(TestFixtures.API_BASE_URL, "tok", "staging").region()).isEqualTo("us-east-1");
    }

    @Test
    void unknownNameIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess(LIST, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(TestFixtures.API_BASE_URL, "tok", "missing"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("datasource with name 'missing' not found");
    }

    @Test
    void incompleteDatasourceIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess(LIST, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(TestFixtures.API_BASE_URL, "tok", "broken"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("selected datasource missing required properties");
    }

    @Test
    void missingDefaultIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(TestFixtures.API_BASE_URL, "tok", null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("default datasource not found");
    }

    @Test
    void nonArrayResponseIsDecodeError() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"error\":\"x\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(TestFixtures.API_BASE_URL, "tok", null))
                .isInstanceOf(DecodeException.class);
    }
}
