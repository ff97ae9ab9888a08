package com.last9.mcpserver.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.last9.mcpserver.query.model.AggFunction;
import com.last9.mcpserver.query.model.AggregateStage;
import com.last9.mcpserver.query.model.Aggregation;
import com.last9.mcpserver.query.model.AndExpr;
import com.last9.mcpserver.query.model.Expr;
import com.last9.mcpserver.query.model.FieldOpExpr;
import com.last9.mcpserver.query.model.FieldOperator;
import com.last9.mcpserver.query.model.FilterStage;
import com.last9.mcpserver.query.model.NotExpr;
import com.last9.mcpserver.query.model.OrExpr;
import com.last9.mcpserver.query.model.ParseStage;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.mcpserver.query.model.SelectStage;
import com.last9.mcpserver.query.model.Stage;
import com.last9.mcpserver.query.model.WindowAggregateStage;
import com.last9.shared.telemetry.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a JSON pipeline into the stage/expression model.
 *
 * Structural problems (unknown stage types or operators, wrong operand counts, non-string field
 * names) are reported as {@link ValidationException} with the stage index in the message.
 */
@Component
public class PipelineParser {

    private final ObjectMapper objectMapper;

    public PipelineParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Pipeline parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("pipeline query is required");
        }
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ValidationException("pipeline query is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a pipeline. A JSON object with a {@code pipeline} array is unwrapped first.
     */
    public Pipeline parse(JsonNode node) {
        JsonNode root = node;
        if (root != null && root.isObject() && root.has("pipeline")) {
            root = root.get("pipeline");
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException("pipeline must be a JSON array of stages");
        }

        List<Stage> stages = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            stages.add(parseStage(root.get(i), i));
        }
        return new Pipeline(stages, (ArrayNode) root);
    }

    private Stage parseStage(JsonNode node, int index) {
        if (!node.isObject()) {
            throw invalid(index, "stage must be an object");
        }
        String type = node.path("type").asText("");
        switch (type) {
            case "filter":
                if (!node.has("query")) {
                    throw invalid(index, "filter stage requires a query");
                }
                return new FilterStage(parseExpr(node.get("query"), index));
            case "parse":
                return parseParse(node, index);
            case "aggregate":
                return parseAggregate(node, index);
            case "window_aggregate":
                return parseWindowAggregate(node, index);
            case "select":
                return parseSelect(node, index);
            default:
                throw invalid(index, type.isEmpty() ? "stage type is missing" : "unknown stage type '" + type + "'");
        }
    }

    Expr parseExpr(JsonNode node, int index) {
        if (node.isArray()) {
            return new AndExpr(parseChildren(node, index));
        }
        if (!node.isObject() || node.size() == 0) {
            throw invalid(index, "filter expression must be a non-empty object");
        }
        if (node.size() > 1) {
            // several operators side by side are combined with $and
            List<Expr> parts = new ArrayList<>();
            node.fields().forEachRemaining(e -> parts.add(parseOperator(e.getKey(), e.getValue(), index)));
            return new AndExpr(parts);
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        return parseOperator(entry.getKey(), entry.getValue(), index);
    }

    private Expr parseOperator(String op, JsonNode operands, int index) {
        switch (op) {
            case "$and":
                return new AndExpr(parseChildren(requireArray(operands, op, index), index));
            case "$or":
                return new OrExpr(parseChildren(requireArray(operands, op, index), index));
            case "$not":
                if (operands.isArray() && operands.size() == 1) {
                    return new NotExpr(parseExpr(operands.get(0), index));
                }
                return new NotExpr(parseExpr(operands, index));
            default:
                FieldOperator operator = FieldOperator.fromJson(op)
                        .orElseThrow(() -> invalid(index, "unknown operator '" + op + "'"));
                return parseFieldOp(operator, operands, index);
        }
    }

    private FieldOpExpr parseFieldOp(FieldOperator operator, JsonNode operands, int index) {
        String op = operator.getJson();
        if (!operands.isArray() || operands.size() != operator.getArity()) {
            throw invalid(index, String.format("%s expects %d operand(s)", op, operator.getArity()));
        }
        JsonNode field = operands.get(0);
        if (!field.isTextual() || field.asText().isEmpty()) {
            throw invalid(index, op + " field name must be a non-empty string");
        }
        JsonNode value = operator.getArity() > 1 ? operands.get(1) : null;
        return new FieldOpExpr(operator, field.asText(), value);
    }

    private List<Expr> parseChildren(JsonNode array, int index) {
        List<Expr> children = new ArrayList<>();
        for (JsonNode child : array) {
            children.add(parseExpr(child, index));
        }
        return children;
    }

    private ParseStage parseParse(JsonNode node, int index) {
        String parserName = node.path("parser").asText("");
        ParseStage.Parser parser = ParseStage.Parser.fromJson(parserName)
                .orElseThrow(() -> invalid(index, "unknown parser '" + parserName + "', expected json, regexp or logfmt"));
        JsonNode pattern = node.get("pattern");
        if (parser == ParseStage.Parser.REGEXP && (pattern == null || !pattern.isTextual())) {
            throw invalid(index, "regexp parser requires a pattern");
        }
        return new ParseStage(parser, pattern != null && pattern.isTextual() ? pattern.asText() : null,
                stringMap(node.get("labels"), "labels", index));
    }

    private AggregateStage parseAggregate(JsonNode node, int index) {
        JsonNode aggregates = node.get("aggregates");
        if (aggregates == null || !aggregates.isArray() || aggregates.isEmpty()) {
            throw invalid(index, "aggregate stage requires a non-empty aggregates array");
        }
        List<Aggregation> parsed = new ArrayList<>();
        for (JsonNode aggregate : aggregates) {
            if (!aggregate.isObject()) {
                throw invalid(index, "aggregate entry must be an object");
            }
            parsed.add(new Aggregation(parseFunction(aggregate.get("function"), index), optionalText(aggregate, "as")));
        }
        return new AggregateStage(parsed, stringMap(node.get("groupby"), "groupby", index));
    }

    private WindowAggregateStage parseWindowAggregate(JsonNode node, int index) {
        JsonNode window = node.get("window");
        if (window == null || !window.isArray() || window.size() != 2 || !window.get(1).isTextual()
                || !(window.get(0).isTextual() || window.get(0).isNumber())) {
            throw invalid(index, "window must be [amount, unit]");
        }
        return new WindowAggregateStage(parseFunction(node.get("function"), index), optionalText(node, "as"),
                window.get(0).asText(), window.get(1).asText(), stringMap(node.get("groupby"), "groupby", index));
    }

    private SelectStage parseSelect(JsonNode node, int index) {
        JsonNode limit = node.get("limit");
        if (limit == null || !limit.canConvertToInt() || limit.asInt() <= 0) {
            throw invalid(index, "select stage requires a positive integer limit");
        }
        return new SelectStage(limit.asInt());
    }

    private AggFunction parseFunction(JsonNode node, int index) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw invalid(index, "aggregation function must be an object with exactly one operator");
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        AggFunction.Type type = AggFunction.Type.fromJson(entry.getKey())
                .orElseThrow(() -> invalid(index, "unknown aggregation function '" + entry.getKey() + "'"));
        JsonNode operands = entry.getValue();
        if (!operands.isArray()) {
            throw invalid(index, type.getJson() + " operands must be an array");
        }
        switch (type) {
            case COUNT:
                if (!operands.isEmpty()) {
                    throw invalid(index, "$count takes no operands");
                }
                return new AggFunction(type, null, null);
            case QUANTILE:
                if (operands.size() != 2 || !(operands.get(0).isNumber() || operands.get(0).isTextual())
                        || !operands.get(1).isTextual()) {
                    throw invalid(index, "$quantile expects [percentile, field]");
                }
                return new AggFunction(type, operands.get(1).asText(), operands.get(0).asDouble());
            default:
                if (operands.size() != 1 || !operands.get(0).isTextual()) {
                    throw invalid(index, type.getJson() + " expects [field]");
                }
                return new AggFunction(type, operands.get(0).asText(), null);
        }
    }

    private Map<String, String> stringMap(JsonNode node, String name, int index) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw invalid(index, name + " must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isTextual()) {
                throw invalid(index, name + " values must be strings");
            }
            result.put(e.getKey(), e.getValue().asText());
        }
        return result;
    }

    private static JsonNode requireArray(JsonNode node, String op, int index) {
        if (!node.isArray()) {
            throw invalid(index, op + " expects an array of expressions");
        }
        return node;
    }

    private static String optionalText(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static ValidationException invalid(int index, String message) {
        return new ValidationException(String.format("invalid pipeline stage %d: %s", index, message));
    }
}
