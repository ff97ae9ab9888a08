package com.last9.mcpserver.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.last9.mcpserver.request.QueryRequestBuilder;
import com.last9.mcpserver.request.TelemetryBackendClient;
import com.last9.shared.telemetry.exception.DecodeException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Exchanges the refresh token for a short-lived access token.
 */
@Component
@Log4j2
public class TokenExchangeClient {

    private final QueryRequestBuilder requestBuilder;
    private final TelemetryBackendClient backendClient;

    public TokenExchangeClient(QueryRequestBuilder requestBuilder, TelemetryBackendClient backendClient) {
        this.requestBuilder = requestBuilder;
        this.backendClient = backendClient;
    }

    /**
     * @param actionUrl    OAuth host taken from the refresh token audience
     * @param refreshToken long-lived credential
     * @return the new access token
     */
    public String exchange(String actionUrl, String refreshToken) {
        log.info("Exchanging refresh token at {}", actionUrl);
        JsonNode response = backendClient.execute(requestBuilder.tokenExchange(actionUrl, refreshToken));
        JsonNode token = response.path("access_token");
        if (!token.isTextual() || token.asText().isEmpty()) {
            throw new DecodeException("access_token missing from token exchange response");
        }
        return token.asText();
    }
}
