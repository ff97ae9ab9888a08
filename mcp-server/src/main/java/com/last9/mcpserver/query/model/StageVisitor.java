package com.last9.mcpserver.query.model;

public interface StageVisitor<R> {

    R visitFilter(FilterStage stage);

    R visitParse(ParseStage stage);

    R visitAggregate(AggregateStage stage);

    R visitWindowAggregate(WindowAggregateStage stage);

    R visitSelect(SelectStage stage);
}
