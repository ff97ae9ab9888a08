package com.last9.mcpserver.query.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Leaf operators of a filter expression, keyed by their JSON name.
 */
public enum FieldOperator {
    EQ("$eq", 2),
    NEQ("$neq", 2),
    GT("$gt", 2),
    LT("$lt", 2),
    GTE("$gte", 2),
    LTE("$lte", 2),
    CONTAINS("$contains", 2),
    NOT_CONTAINS("$notcontains", 2),
    REGEX("$regex", 2),
    NOT_REGEX("$notregex", 2),
    EXISTS("$exists", 1),
    NOT_NULL("$notnull", 1);

    private final String json;
    private final int arity;

    FieldOperator(String json, int arity) {
        this.json = json;
        this.arity = arity;
    }

    public String getJson() {
        return json;
    }

    /** Number of operands, including the field name. */
    public int getArity() {
        return arity;
    }

    /** Unary existence probes; their field is not checked against the attribute catalog. */
    public boolean isExistenceProbe() {
        return arity == 1;
    }

    public static Optional<FieldOperator> fromJson(String name) {
        return Arrays.stream(values()).filter(op -> op.json.equals(name)).findFirst();
    }
}
