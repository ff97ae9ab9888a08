package com.last9.mcpserver.query.model;

/**
 * One step of a pipeline. Implementations are the five stage records of this package.
 */
public interface Stage {

    <R> R accept(StageVisitor<R> visitor);
}
