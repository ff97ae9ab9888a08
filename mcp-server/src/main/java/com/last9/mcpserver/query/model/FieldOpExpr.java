package com.last9.mcpserver.query.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Comparison leaf, encoded as {@code {"<op>": [field, value]}}.
 *
 * @param value compared value, null for unary operators
 */
public record FieldOpExpr(FieldOperator operator, String field, JsonNode value) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFieldOp(this);
    }
}
