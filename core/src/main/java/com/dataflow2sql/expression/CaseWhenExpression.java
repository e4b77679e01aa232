package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Searched CASE expression.
 *
 * <p>SQL form:
 * <pre>
 *   CASE WHEN cond1 THEN val1 WHEN cond2 THEN val2 ELSE default END
 * </pre>
 */
public final class CaseWhenExpression implements Expression {

    /**
     * One WHEN ... THEN ... branch.
     *
     * @param condition the branch condition
     * @param result the branch value
     */
    public record WhenClause(Expression condition, Expression result) {
        public WhenClause {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    private final List<WhenClause> whenClauses;
    private final Expression elseResult;

    /**
     * Creates a CASE expression.
     *
     * @param whenClauses the branches, at least one
     * @param elseResult the ELSE value (may be null for an implicit NULL)
     */
    public CaseWhenExpression(List<WhenClause> whenClauses, Expression elseResult) {
        Objects.requireNonNull(whenClauses, "whenClauses must not be null");
        if (whenClauses.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN clause");
        }
        this.whenClauses = List.copyOf(whenClauses);
        this.elseResult = elseResult;
    }

    public List<WhenClause> whenClauses() {
        return whenClauses;
    }

    /**
     * Returns the ELSE value.
     *
     * @return the ELSE value, or null when absent
     */
    public Expression elseResult() {
        return elseResult;
    }

    @Override
    public DataType dataType() {
        return whenClauses.get(0).result().dataType();
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        for (WhenClause clause : whenClauses) {
            children.add(clause.condition());
            children.add(clause.result());
        }
        if (elseResult != null) {
            children.add(elseResult);
        }
        return children;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCaseWhen(this);
    }

    @Override
    public String toString() {
        return "CASE" + whenClauses + " ELSE " + elseResult;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return whenClauses.equals(that.whenClauses) && Objects.equals(elseResult, that.elseResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(whenClauses, elseResult);
    }

    /**
     * Creates {@code CASE WHEN condition THEN 1 ELSE 0 END}.
     *
     * @param condition the boolean condition
     * @return the indicator expression
     */
    public static CaseWhenExpression indicator(Expression condition) {
        return new CaseWhenExpression(
            List.of(new WhenClause(condition, Literal.of(1L))), Literal.of(0L));
    }
}
