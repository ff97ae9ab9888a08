package com.last9.mcpserver.query.model;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.List;

/**
 * Parsed pipeline. Keeps the structured stages for validation and the submitted JSON, which is
 * what gets sent to the backend.
 */
public final class Pipeline {

    private final List<Stage> stages;
    private final ArrayNode source;

    public Pipeline(List<Stage> stages, ArrayNode source) {
        this.stages = List.copyOf(stages);
        this.source = source.deepCopy();
    }

    public List<Stage> getStages() {
        return stages;
    }

    /** Copy of the JSON array this pipeline was parsed from. */
    public ArrayNode toJson() {
        return source.deepCopy();
    }

    @Override
    public String toString() {
        return source.toString();
    }
}
