package com.last9.mcpserver.request;

/**
 * Per-call knobs for a pipeline query. Null fields fall back to the builder defaults.
 *
 * @param limit     requested record count, clamped by {@link QueryRequestBuilder#resolveLimit}
 * @param scope     selects the default limit when none was requested
 * @param order     sort column, default Timestamp
 * @param direction backward or forward, default backward
 * @param index     physical index hint for log queries, e.g. physical_index:payments
 */
public record QueryOptions(Integer limit, LimitScope scope, String order, String direction, String index) {

    public enum LimitScope {
        GENERAL,
        SERVICE_TRACES
    }

    public static QueryOptions limit(Integer limit) {
        return new QueryOptions(limit, LimitScope.GENERAL, null, null, null);
    }

    public QueryOptions withIndex(String physicalIndex) {
        return new QueryOptions(limit, scope, order, direction, physicalIndex);
    }
}
