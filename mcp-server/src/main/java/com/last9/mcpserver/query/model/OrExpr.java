package com.last9.mcpserver.query.model;

import java.util.List;

public record OrExpr(List<Expr> children) implements Expr {

    public OrExpr {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
