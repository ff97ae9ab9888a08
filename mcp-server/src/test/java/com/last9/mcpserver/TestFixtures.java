package com.last9.mcpserver;

import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.mcpserver.session.Datasource;
import com.last9.mcpserver.session.SessionSnapshot;

import java.time.Instant;

/**
 * Shared session and configuration values for unit tests.
 */
public final class TestFixtures {

    public static final String API_BASE_URL = "https://app.last9.io/api/v4/organizations/acme";
    public static final String ACCESS_TOKEN = "access-token";

    private TestFixtures() {
    }

    public static Datasource datasource() {
        return new Datasource("prod-metrics", "https://read.example.com/prom", "ap-south-1", "reader", "s3cret");
    }

    public static SessionSnapshot session() {
        Instant expiresAt = Instant.parse("2030-01-01T00:00:00Z");
        return new SessionSnapshot(ACCESS_TOKEN, expiresAt, expiresAt.minusSeconds(3600), "acme",
                "https://otlp.example.com/api", API_BASE_URL, datasource());
    }

    public static Last9Properties properties() {
        return new Last9Properties();
    }
}
