package com.last9.mcpserver.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.model.ExceptionRecord;
import com.last9.shared.telemetry.model.LogRecord;
import com.last9.shared.telemetry.model.TraceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void logsFlattenStreamsWithLabelFallbacks() throws Exception {
        JsonNode response = json("""
                {"data":{"result":[
                  {"stream":{"ServiceName":"checkout","level":"warn"},
                   "values":[["1717236000000000000","first"],["1717236001500000000","second"]]},
                  {"stream":{},"values":[[1717236002000000000,"third"],["bad"]]}
                ]}}
                """);

        List<LogRecord> records = normalizer.normalizeLogs(response, "fallback", 0);

        assertThat(records).containsExactly(
                new LogRecord("checkout", "2024-06-01T10:00:00Z", "first", "warn"),
                new LogRecord("checkout", "2024-06-01T10:00:01Z", "second", "warn"),
                new LogRecord("fallback", "2024-06-01T10:00:02Z", "third", ""));
    }

    @Test
    void logLimitBoundsRecordsAcrossStreams() throws Exception {
        JsonNode response = json("""
                {"data":{"result":[
                  {"stream":{"service":"a"},"values":[["1","x"],["2","y"]]},
                  {"stream":{"service":"b"},"values":[["3","z"]]}
                ]}}
                """);

        assertThat(normalizer.normalizeLogs(response, null, 2)).extracting(LogRecord::message).containsExactly("x", "y");
    }

    @Test
    void logsRequireDataResult() throws Exception {
        assertThatThrownBy(() -> normalizer.normalizeLogs(json("{\"result\":[]}"), null, 0))
                .isInstanceOf(DecodeException.class)
                .hasMessage("invalid response structure: missing data.result array");
    }

    @Test
    void tracesConvertDurationToMillis() throws Exception {
        JsonNode response = json("""
                {"data":{"result":[
                  {"TraceId":"t1","SpanId":"s1","SpanKind":"SPAN_KIND_SERVER","SpanName":"GET /",
                   "ServiceName":"api","Duration":1500000,"Timestamp":"2024-06-01T10:00:00.123456789+05:30",
                   "TraceState":"","StatusCode":"STATUS_CODE_OK","StatusMessage":""},
                  {"TraceId":"t2","Duration":"2500000000","Timestamp":"not-a-time"}
                ]}}
                """);

        List<TraceRecord> records = normalizer.normalizeTraces(response);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).durationMs()).isEqualTo(1.5);
        assertThat(records.get(0).timestamp()).isEqualTo("2024-06-01T04:30:00.123456789Z");
        assertThat(records.get(0).spanKind()).isEqualTo("SPAN_KIND_SERVER");
        assertThat(records.get(1).durationMs()).isEqualTo(2500.0);
        assertThat(records.get(1).timestamp()).isEqualTo("not-a-time");
        assertThat(records.get(1).serviceName()).isEmpty();
    }

    @Test
    void tracesAcceptTopLevelResult() throws Exception {
        assertThat(normalizer.normalizeTraces(json("{\"result\":[{\"TraceId\":\"t\"}]}")))
                .extracting(TraceRecord::traceId).containsExactly("t");
    }

    @Test
    void tracesRejectMissingResult() throws Exception {
        assertThatThrownBy(() -> normalizer.normalizeTraces(json("{\"data\":{}}")))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void exceptionsPromotedFromSpanOrEventAttributes() throws Exception {
        JsonNode response = json("""
                {"data":{"result":[
                  {"TraceId":"t1","ServiceName":"api","Duration":1000000,
                   "SpanAttributes":{"exception.type":"NullPointerException","exception.message":"npe"},
                   "ResourceAttributes":{"deployment.environment":"prod","service.namespace":"shop"}},
                  {"TraceId":"t2","attributes":{"http.method":"GET"},
                   "Events.Attributes":[{"exception.type":"TimeoutError","exception.escaped":"true"}],
                   "resources":{"service.instance.id":"pod-1"}},
                  {"TraceId":"t3","SpanAttributes":{"http.method":"GET"}}
                ]}}
                """);

        List<ExceptionRecord> records = normalizer.normalizeExceptions(response);

        assertThat(records).hasSize(2);
        ExceptionRecord first = records.get(0);
        assertThat(first.exceptionType()).isEqualTo("NullPointerException");
        assertThat(first.exceptionMessage()).isEqualTo("npe");
        assertThat(first.deploymentEnvironment()).isEqualTo("prod");
        assertThat(first.serviceNamespace()).isEqualTo("shop");
        assertThat(first.durationMs()).isEqualTo(1.0);
        ExceptionRecord second = records.get(1);
        assertThat(second.traceId()).isEqualTo("t2");
        assertThat(second.exceptionType()).isEqualTo("TimeoutError");
        assertThat(second.exceptionEscaped()).isEqualTo("true");
        assertThat(second.serviceInstanceId()).isEqualTo("pod-1");
    }

    @Test
    void exceptionTypeFoundInLaterAttributeObject() throws Exception {
        JsonNode response = json("""
                {"data":{"result":[
                  {"TraceId":"t4","ServiceName":"api",
                   "SpanAttributes":{"http.method":"POST"},
                   "attributes":{"exception.type":"IllegalStateException","exception.message":"closed"}}
                ]}}
                """);

        List<ExceptionRecord> records = normalizer.normalizeExceptions(response);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).exceptionType()).isEqualTo("IllegalStateException");
        assertThat(records.get(0).exceptionMessage()).isEqualTo("closed");
    }
}
