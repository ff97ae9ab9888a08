package com.last9.mcpserver.query.model;

import java.util.List;
import java.util.Map;

/**
 * @param groupby field to output alias
 */
public record AggregateStage(List<Aggregation> aggregates, Map<String, String> groupby) implements Stage {

    public AggregateStage {
        aggregates = List.copyOf(aggregates);
        groupby = Map.copyOf(groupby);
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitAggregate(this);
    }
}
