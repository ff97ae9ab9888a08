package com.last9.mcpserver.query.model;

import java.util.Map;

/**
 * Aggregation over fixed time buckets, e.g. window {@code ["5", "minutes"]}.
 */
public record WindowAggregateStage(AggFunction function, String alias, String windowAmount, String windowUnit,
                                   Map<String, String> groupby) implements Stage {

    public WindowAggregateStage {
        groupby = Map.copyOf(groupby);
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitWindowAggregate(this);
    }
}
