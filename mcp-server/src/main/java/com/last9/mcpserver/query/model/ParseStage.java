package com.last9.mcpserver.query.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts new fields from the log body.
 *
 * @param labels capture name to alias; the aliases become fields later stages may reference
 */
public record ParseStage(Parser parser, String pattern, Map<String, String> labels) implements Stage {

    public enum Parser {
        JSON("json"),
        REGEXP("regexp"),
        LOGFMT("logfmt");

        private final String json;

        Parser(String json) {
            this.json = json;
        }

        public static Optional<Parser> fromJson(String name) {
            return Arrays.stream(values()).filter(p -> p.json.equals(name)).findFirst();
        }
    }

    public ParseStage {
        labels = Map.copyOf(labels);
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitParse(this);
    }
}
