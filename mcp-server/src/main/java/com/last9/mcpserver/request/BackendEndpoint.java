package com.last9.mcpserver.request;

import org.springframework.http.HttpMethod;

/**
 * Backend endpoints called by the server. Paths are relative to the tenant API base URL,
 * except {@link #OAUTH_ACCESS_TOKEN} which is relative to the action URL.
 */
public enum BackendEndpoint {

    LOGS_QUERY_RANGE("/logs/api/v2/query_range/json", HttpMethod.POST),
    TRACES_QUERY_RANGE("/cat/api/traces/v2/query_range/json", HttpMethod.POST),
    LOGS_LABELS("/logs/api/v1/labels", HttpMethod.GET),
    LOGS_SERIES("/logs/api/v2/series/json", HttpMethod.POST),
    TRACES_SERIES("/cat/api/traces/v2/series/json", HttpMethod.POST),
    PROM_QUERY("/prom_query", HttpMethod.POST),
    PROM_QUERY_INSTANT("/prom_query_instant", HttpMethod.POST),
    PROM_LABEL_VALUES("/prom_label_values", HttpMethod.POST),
    PROM_LABELS("/apm/labels", HttpMethod.POST),
    DATASOURCES("/datasources", HttpMethod.GET),
    OAUTH_ACCESS_TOKEN("/api/v4/oauth/access_token", HttpMethod.POST);

    private final String path;
    private final HttpMethod method;
    private final EpochUnit timeUnit;

    BackendEndpoint(String path, HttpMethod method) {
        this(path, method, EpochUnit.SECONDS);
    }

    BackendEndpoint(String path, HttpMethod method, EpochUnit timeUnit) {
        this.path = path;
        this.method = method;
        this.timeUnit = timeUnit;
    }

    public String getPath() {
        return path;
    }

    public HttpMethod getMethod() {
        return method;
    }

    /** Unit of the start, end, timestamp and window values this endpoint expects. */
    public EpochUnit getTimeUnit() {
        return timeUnit;
    }
}
