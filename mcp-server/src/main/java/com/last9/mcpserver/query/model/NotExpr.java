package com.last9.mcpserver.query.model;

public record NotExpr(Expr child) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
