package com.last9.mcpserver.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.last9.shared.telemetry.exception.DecodeException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Decodes the payload segment without checking the signature. Tokens only ever arrive over
 * TLS from the backend itself.
 */
@Component
public class UnverifiedJwtClaimsDecoder implements JwtClaimsDecoder {

    private final ObjectMapper objectMapper;

    public UnverifiedJwtClaimsDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public JwtClaims decode(String token) {
        if (token == null) {
            throw new DecodeException("invalid JWT token format: token is empty");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new DecodeException("invalid JWT token format: expected 3 segments, found " + parts.length);
        }

        JsonNode payload;
        try {
            byte[] bytes = Base64.getUrlDecoder().decode(stripPadding(parts[1]));
            payload = objectMapper.readTree(bytes);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("failed to decode token payload", e);
        } catch (IOException e) {
            throw new DecodeException("failed to parse token claims", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new DecodeException("failed to parse token claims: payload is not a JSON object");
        }

        String orgSlug = payload.path("organization_slug").isTextual()
                ? payload.get("organization_slug").asText() : null;
        Instant expiresAt = payload.path("exp").isNumber()
                ? Instant.ofEpochSecond(payload.get("exp").asLong()) : null;
        return new JwtClaims(orgSlug, audience(payload.path("aud")), expiresAt);
    }

    private static List<String> audience(JsonNode aud) {
        List<String> values = new ArrayList<>();
        if (aud.isTextual()) {
            values.add(aud.asText());
        } else if (aud.isArray()) {
            for (JsonNode entry : aud) {
                if (entry.isTextual()) {
                    values.add(entry.asText());
                }
            }
        }
        return values;
    }

    private static String stripPadding(String segment) {
        int end = segment.length();
        while (end > 0 && segment.charAt(end - 1) == '=') {
            end--;
        }
        return segment.substring(0, end);
    }
}
