package com.last9.mcpserver.query.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregation function applied by aggregate and window_aggregate stages.
 *
 * @param type  function kind
 * @param field aggregated field; null for $count
 * @param quantile percentile for $quantile, otherwise null
 */
public record AggFunction(Type type, String field, Double quantile) {

    public enum Type {
        SUM("$sum"),
        AVG("$avg"),
        COUNT("$count"),
        MIN("$min"),
        MAX("$max"),
        QUANTILE("$quantile");

        private final String json;

        Type(String json) {
            this.json = json;
        }

        public String getJson() {
            return json;
        }

        public static Optional<Type> fromJson(String name) {
            return Arrays.stream(values()).filter(t -> t.json.equals(name)).findFirst();
        }
    }

    public Optional<String> referencedField() {
        return Optional.ofNullable(field);
    }
}
