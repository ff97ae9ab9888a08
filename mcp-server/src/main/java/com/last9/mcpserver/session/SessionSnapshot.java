package com.last9.mcpserver.session;

import java.time.Instant;

/**
 * Immutable view of the session published after each refresh. Readers always see a
 * consistent token, tenant and datasource.
 *
 * @param refreshAt instant after which the next caller refreshes the token
 */
public record SessionSnapshot(
        String accessToken,
        Instant expiresAt,
        Instant refreshAt,
        String orgSlug,
        String actionUrl,
        String apiBaseUrl,
        Datasource datasource) {

    public String region() {
        return datasource != null ? datasource.region() : null;
    }

    SessionSnapshot withDatasource(Datasource ds) {
        return new SessionSnapshot(accessToken, expiresAt, refreshAt, orgSlug, actionUrl, apiBaseUrl, ds);
    }

    @Override
    public String toString() {
        return "SessionSnapshot{orgSlug=" + orgSlug + ", apiBaseUrl=" + apiBaseUrl
                + ", expiresAt=" + expiresAt + ", refreshAt=" + refreshAt + ", datasource=" + datasource + "}";
    }
}
