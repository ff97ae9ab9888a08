package com.last9.mcpserver.query.model;

public record FilterStage(Expr query) implements Stage {

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitFilter(this);
    }
}
