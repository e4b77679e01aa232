package com.dataflow2sql.lowering;

import com.dataflow2sql.expression.AggregateFunction;
import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.CaseWhenExpression;
import com.dataflow2sql.expression.CastExpression;
import com.dataflow2sql.expression.ColumnReference;
import com.dataflow2sql.expression.DateTruncExpression;
import com.dataflow2sql.expression.ElementReference;
import com.dataflow2sql.expression.Expression;
import com.dataflow2sql.expression.ExpressionVisitor;
import com.dataflow2sql.expression.FunctionCall;
import com.dataflow2sql.expression.Literal;
import com.dataflow2sql.expression.RawSQLExpression;
import com.dataflow2sql.expression.UnaryExpression;
import com.dataflow2sql.logical.DataflowPlanNode;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import com.dataflow2sql.types.DoubleType;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the element references of an authored expression with column
 * references to the aliases of a node's input.
 *
 * <p>References are qualified by the input's subquery alias, or left
 * unqualified when {@code qualifier} is null (WHERE predicates refer to the
 * input's aliases directly). With {@code guardDivisions}, every divisor is
 * wrapped in {@code NULLIF(divisor, 0)} so a zero divisor yields NULL, and a
 * division with no floating-point operand casts its dividend to double so
 * every dialect divides the same way.
 */
final class ElementReferenceRewriter implements ExpressionVisitor<Expression> {

    private final DataflowPlanNode node;
    private final OutputSchema input;
    private final String qualifier;
    private final boolean guardDivisions;

    /**
     * Creates a rewriter.
     *
     * @param node the node owning the expression, reported on failures
     * @param input the schema references resolve against
     * @param qualifier the input alias, or null for unqualified references
     * @param guardDivisions whether divisions are guarded against zero divisors
     */
    ElementReferenceRewriter(DataflowPlanNode node, OutputSchema input, String qualifier, boolean guardDivisions) {
        this.node = node;
        this.input = input;
        this.qualifier = qualifier;
        this.guardDivisions = guardDivisions;
    }

    Expression rewrite(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Expression visitElementReference(ElementReference reference) {
        OutputColumn column = node.resolveReference(input, reference.identifier());
        return new ColumnReference(column.alias(), qualifier, column.dataType());
    }

    @Override
    public Expression visitColumnReference(ColumnReference reference) {
        return reference;
    }

    @Override
    public Expression visitLiteral(Literal literal) {
        return literal;
    }

    @Override
    public Expression visitRawSQL(RawSQLExpression expression) {
        return expression;
    }

    @Override
    public Expression visitBinary(BinaryExpression expression) {
        Expression left = rewrite(expression.left());
        Expression right = rewrite(expression.right());
        if (guardDivisions && expression.operator() == BinaryExpression.Operator.DIVIDE) {
            if (!(left.dataType() instanceof DoubleType) && !(right.dataType() instanceof DoubleType)) {
                left = new CastExpression(left, DoubleType.get());
            }
            right = FunctionCall.nullIf(right, Literal.of(0L));
        }
        return new BinaryExpression(left, expression.operator(), right);
    }

    @Override
    public Expression visitUnary(UnaryExpression expression) {
        return new UnaryExpression(expression.operator(), rewrite(expression.operand()));
    }

    @Override
    public Expression visitFunctionCall(FunctionCall call) {
        return new FunctionCall(call.functionName(), rewriteAll(call.arguments()), call.dataType());
    }

    @Override
    public Expression visitAggregateFunction(AggregateFunction function) {
        return new AggregateFunction(function.function(), function.isDistinct(), rewrite(function.argument()));
    }

    @Override
    public Expression visitDateTrunc(DateTruncExpression expression) {
        return new DateTruncExpression(expression.granularity(), rewrite(expression.argument()));
    }

    @Override
    public Expression visitCast(CastExpression expression) {
        return new CastExpression(rewrite(expression.expression()), expression.targetType());
    }

    @Override
    public Expression visitCaseWhen(CaseWhenExpression expression) {
        List<CaseWhenExpression.WhenClause> clauses = new ArrayList<>();
        for (CaseWhenExpression.WhenClause clause : expression.whenClauses()) {
            clauses.add(new CaseWhenExpression.WhenClause(rewrite(clause.condition()), rewrite(clause.result())));
        }
        Expression elseResult = expression.elseResult() == null ? null : rewrite(expression.elseResult());
        return new CaseWhenExpression(clauses, elseResult);
    }

    private List<Expression> rewriteAll(List<Expression> expressions) {
        List<Expression> rewritten = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            rewritten.add(rewrite(expression));
        }
        return rewritten;
    }
}
