package com.last9.mcpserver.validation;

import com.last9.mcpserver.query.model.AggFunction;
import com.last9.mcpserver.query.model.AggregateStage;
import com.last9.mcpserver.query.model.Aggregation;
import com.last9.mcpserver.query.model.AndExpr;
import com.last9.mcpserver.query.model.ExprVisitor;
import com.last9.mcpserver.query.model.FieldOpExpr;
import com.last9.mcpserver.query.model.FilterStage;
import com.last9.mcpserver.query.model.NotExpr;
import com.last9.mcpserver.query.model.OrExpr;
import com.last9.mcpserver.query.model.ParseStage;
import com.last9.mcpserver.query.model.Pipeline;
import com.last9.mcpserver.query.model.SelectStage;
import com.last9.mcpserver.query.model.Stage;
import com.last9.mcpserver.query.model.StageVisitor;
import com.last9.mcpserver.query.model.WindowAggregateStage;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Walks a pipeline and records the field names it references and the names its parse stages
 * derive. Derived names form one set for the whole pipeline, regardless of stage order.
 *
 * <p>Not thread safe; create one per pipeline through {@link #collect(Pipeline)}.
 */
final class FieldReferenceCollector implements StageVisitor<Void>, ExprVisitor<Void> {

    private final Set<String> referenced = new LinkedHashSet<>();
    private final Set<String> derived = new LinkedHashSet<>();

    private FieldReferenceCollector() {
    }

    static FieldReferenceCollector collect(Pipeline pipeline) {
        FieldReferenceCollector collector = new FieldReferenceCollector();
        for (Stage stage : pipeline.getStages()) {
            stage.accept(collector);
        }
        return collector;
    }

    /** Field names subject to catalog checks, in first-seen order. */
    Set<String> referenced() {
        return Collections.unmodifiableSet(referenced);
    }

    Set<String> derived() {
        return Collections.unmodifiableSet(derived);
    }

    @Override
    public Void visitFilter(FilterStage stage) {
        return stage.query().accept(this);
    }

    @Override
    public Void visitParse(ParseStage stage) {
        stage.labels().values().stream().filter(alias -> !alias.isEmpty()).forEach(derived::add);
        return null;
    }

    @Override
    public Void visitAggregate(AggregateStage stage) {
        for (Aggregation aggregation : stage.aggregates()) {
            addFunction(aggregation.function());
        }
        referenced.addAll(stage.groupby().keySet());
        return null;
    }

    @Override
    public Void visitWindowAggregate(WindowAggregateStage stage) {
        addFunction(stage.function());
        referenced.addAll(stage.groupby().keySet());
        return null;
    }

    @Override
    public Void visitSelect(SelectStage stage) {
        return null;
    }

    @Override
    public Void visitAnd(AndExpr expr) {
        expr.children().forEach(child -> child.accept(this));
        return null;
    }

    @Override
    public Void visitOr(OrExpr expr) {
        expr.children().forEach(child -> child.accept(this));
        return null;
    }

    @Override
    public Void visitNot(NotExpr expr) {
        return expr.child().accept(this);
    }

    @Override
    public Void visitFieldOp(FieldOpExpr expr) {
        // $exists and $notnull probe for presence; the field may legitimately be absent
        if (!expr.operator().isExistenceProbe()) {
            referenced.add(expr.field());
        }
        return null;
    }

    private void addFunction(AggFunction function) {
        function.referencedField().ifPresent(referenced::add);
    }
}
