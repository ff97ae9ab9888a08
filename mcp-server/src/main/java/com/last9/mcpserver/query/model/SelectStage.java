package com.last9.mcpserver.query.model;

public record SelectStage(int limit) implements Stage {

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }
}
