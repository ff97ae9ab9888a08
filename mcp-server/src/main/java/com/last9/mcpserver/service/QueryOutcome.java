package com.last9.mcpserver.service;

import com.last9.mcpserver.time.TimeRange;

import java.util.List;

/**
 * Records returned by a query, plus warnings from degraded side steps (attribute discovery,
 * physical index lookup) that did not fail the query.
 */
public record QueryOutcome<T>(List<T> records, List<String> warnings, TimeRange range) {

    public QueryOutcome {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }
}
