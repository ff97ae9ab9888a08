package com.last9.mcpserver.session;

import java.time.Instant;
import java.util.List;

/**
 * Claims read from a backend token. Any field may be null when the claim is absent; callers
 * decide which ones they require.
 *
 * @param audience values of the {@code aud} claim, in order
 */
public record JwtClaims(String organizationSlug, List<String> audience, Instant expiresAt) {

    /**
     * Action URL derived from the first audience entry, with https:// added when no scheme is
     * present. Null if there is no audience.
     */
    public String actionUrl() {
        if (audience == null || audience.isEmpty()) {
            return null;
        }
        String aud = audience.get(0);
        if (aud.startsWith("https://") || aud.startsWith("http://")) {
            return aud;
        }
        return "https://" + aud;
    }
}
