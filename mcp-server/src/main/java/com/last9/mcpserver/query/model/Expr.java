package com.last9.mcpserver.query.model;

/**
 * Node of a filter expression tree: {@link AndExpr}, {@link OrExpr}, {@link NotExpr} or a
 * {@link FieldOpExpr} leaf.
 */
public interface Expr {

    <R> R accept(ExprVisitor<R> visitor);
}
