package com.last9.mcpserver.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.shared.telemetry.exception.DecodeException;
import com.last9.shared.telemetry.exception.UpstreamException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Executes built requests over the shared RestTemplate and parses the JSON response.
 * No retries: failures surface immediately as typed exceptions.
 */
@Service
@Log4j2
public class TelemetryBackendClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public TelemetryBackendClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Execute a request and return the parsed response body
     *
     * @throws UpstreamException on a non-2xx status or a transport failure
     * @throws DecodeException   when the body is empty or not JSON
     */
    public JsonNode execute(BackendRequest request) {
        String endpoint = request.endpoint().getPath();
        long startTime = System.currentTimeMillis();
        String responseBody;
        try {
            HttpEntity<String> entity = new HttpEntity<>(serialize(request.body()), request.headers());
            ResponseEntity<String> response = restTemplate.exchange(request.uri(), request.method(), entity, String.class);
            responseBody = response.getBody();
            log.debug("{} {} completed with {} in {}ms", request.method(), endpoint,
                    response.getStatusCode().value(), System.currentTimeMillis() - startTime);
        } catch (HttpStatusCodeException e) {
            log.warn("{} {} failed with status {}", request.method(), endpoint, e.getStatusCode().value());
            throw new UpstreamException(endpoint, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            log.error("{} {} failed after {}ms", request.method(), endpoint, System.currentTimeMillis() - startTime, e);
            throw new UpstreamException(endpoint, e);
        }

        if (!StringUtils.hasText(responseBody)) {
            throw new DecodeException("empty response from " + endpoint);
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new DecodeException("failed to decode response from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
    }

    private String serialize(JsonNode body) {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException("failed to encode request body", e);
        }
    }
}
