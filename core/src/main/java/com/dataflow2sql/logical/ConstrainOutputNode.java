package com.dataflow2sql.logical;

import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.schema.OutputSchema;
import java.util.Objects;

/**
 * Dataflow node keeping only the rows satisfying a predicate.
 *
 * <p>The predicate refers to input elements through
 * {@link com.dataflow2sql.expression.ElementReference}s; the schema is passed
 * through unchanged.
 */
public final class ConstrainOutputNode extends DataflowPlanNode {

    private final Expression predicate;

    public ConstrainOutputNode(DataflowPlanNode parent, Expression predicate) {
        super(single(parent), 1);
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    public Expression predicate() {
        return predicate;
    }

    @Override
    public int requiredParentCount() {
        return 1;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        return parent().outputSchema();
    }

    @Override
    public String description() {
        return "Constrain Output with WHERE";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitConstrainOutput(this);
    }

    @Override
    public String toString() {
        return "ConstrainOutput(" + predicate + ")";
    }
}
