package com.last9.mcpserver.query.model;

import java.util.List;

public record AndExpr(List<Expr> children) implements Expr {

    public AndExpr {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
