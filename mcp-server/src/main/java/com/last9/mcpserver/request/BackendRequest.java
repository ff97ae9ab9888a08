package com.last9.mcpserver.request;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * Fully formed backend call.
 *
 * @param body JSON body, or null for GET requests
 */
public record BackendRequest(BackendEndpoint endpoint, HttpMethod method, URI uri, HttpHeaders headers, JsonNode body) {
}
