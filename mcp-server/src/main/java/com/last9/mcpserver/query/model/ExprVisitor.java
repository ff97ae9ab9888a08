package com.last9.mcpserver.query.model;

public interface ExprVisitor<R> {

    R visitAnd(AndExpr expr);

    R visitOr(OrExpr expr);

    R visitNot(NotExpr expr);

    R visitFieldOp(FieldOpExpr expr);
}
