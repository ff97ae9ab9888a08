package com.last9.mcpserver.query.model;

/**
 * One entry of an aggregate stage's {@code aggregates} list.
 *
 * @param alias output column name from {@code as}, may be null
 */
public record Aggregation(AggFunction function, String alias) {
}
