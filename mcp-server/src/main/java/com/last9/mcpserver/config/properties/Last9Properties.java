package com.last9.mcpserver.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@ConfigurationProperties(prefix = "last9")
@Component
@Data
public class Last9Properties {
    private AuthConfig auth = new AuthConfig();
    private ApiConfig api = new ApiConfig();
    private HttpConfig http = new HttpConfig();
    private QueryConfig query = new QueryConfig();

    @Data
    public static class AuthConfig {
        /** Long-lived refresh token exchanged for short-lived access tokens. */
        private String refreshToken;
        /** Fraction of the token lifetime left unused before refreshing early. */
        private double refreshBufferFraction = 0.5;
    }

    @Data
    public static class ApiConfig {
        private String host = "app.last9.io";
        /** Datasource to select by name; the tenant default is used when blank. */
        private String datasourceName;
        private String userAgent = "Last9-MCP-Server/1.0";
    }

    @Data
    public static class HttpConfig {
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class QueryConfig {
        private int defaultLookbackMinutes = 60;
        private int maxLookbackMinutes = 1440;
        private int maxWindowHours = 24;
        private int defaultLimit = 20;
        private int defaultServiceTraceLimit = 10;
        private int maxLimit = 100;
        /** Log windows longer than this use the labels index instead of a series probe. */
        private int labelsThresholdMinutes = 20;
    }
}
