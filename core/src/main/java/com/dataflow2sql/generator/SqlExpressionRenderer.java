package com.dataflow2sql.generator;

import com.dataflow2sql.exception.UnsupportedConstructException;
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
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders expressions as single-line SQL for one dialect.
 *
 * <p>Binary operands are parenthesized only where operator precedence requires
 * it, so {@code a - (b - c)} and {@code a * (b / c)} keep their parentheses and
 * {@code a + b * c} gets none.
 *
 * <p>Element references must have been resolved by lowering; meeting one here
 * is a programming error.
 */
public class SqlExpressionRenderer implements ExpressionVisitor<String> {

    private final DialectProfile profile;
    private final String location;

    /**
     * Creates a renderer.
     *
     * @param profile the target dialect
     * @param location the statement being rendered, reported on unsupported constructs
     */
    public SqlExpressionRenderer(DialectProfile profile, String location) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    /**
     * Renders an expression.
     *
     * @param expression the expression
     * @return the SQL text
     * @throws UnsupportedConstructException if the dialect cannot express the expression
     */
    public String render(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visitColumnReference(ColumnReference reference) {
        String column = profile.quoteIdentifier(reference.columnName());
        if (reference.isQualified()) {
            return profile.quoteIdentifier(reference.qualifier()) + "." + column;
        }
        return column;
    }

    @Override
    public String visitElementReference(ElementReference reference) {
        throw new IllegalStateException("Element reference " + reference.identifier()
            + " was not resolved before rendering (in: " + location + ")");
    }

    @Override
    public String visitLiteral(Literal literal) {
        Object value = literal.value();
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof LocalDate) {
            return "DATE " + profile.quoteLiteral(value.toString());
        }
        return profile.quoteLiteral(value.toString());
    }

    @Override
    public String visitBinary(BinaryExpression expression) {
        BinaryExpression.Operator operator = expression.operator();
        String left = renderOperand(expression.left(), operator, false);
        String right = renderOperand(expression.right(), operator, true);
        return left + " " + operator.symbol() + " " + right;
    }

    @Override
    public String visitUnary(UnaryExpression expression) {
        String operand = render(expression.operand());
        if (expression.operand() instanceof BinaryExpression
                || (expression.operator() == UnaryExpression.Operator.NEGATE && operand.startsWith("-"))) {
            // "--" would open a comment
            operand = "(" + operand + ")";
        }
        switch (expression.operator()) {
            case NEGATE:
                return "-" + operand;
            case NOT:
                return "NOT " + operand;
            default:
                return operand + " " + expression.operator().symbol();
        }
    }

    @Override
    public String visitFunctionCall(FunctionCall call) {
        StringJoiner arguments = new StringJoiner(", ", call.functionName() + "(", ")");
        for (Expression argument : call.arguments()) {
            arguments.add(render(argument));
        }
        return arguments.toString();
    }

    @Override
    public String visitAggregateFunction(AggregateFunction function) {
        if (function.isDistinct()) {
            if (function.function() == AggregateFunction.Function.COUNT && !profile.supportsCountDistinct()) {
                throw new UnsupportedConstructException(profile.name(), "COUNT(DISTINCT ...)", location);
            }
            return function.function().name() + "(DISTINCT " + render(function.argument()) + ")";
        }
        return function.function().name() + "(" + render(function.argument()) + ")";
    }

    @Override
    public String visitDateTrunc(DateTruncExpression expression) {
        return profile.dateTrunc(expression.granularity(), render(expression.argument()));
    }

    @Override
    public String visitCast(CastExpression expression) {
        return "CAST(" + render(expression.expression()) + " AS " + profile.typeName(expression.targetType()) + ")";
    }

    @Override
    public String visitCaseWhen(CaseWhenExpression expression) {
        StringBuilder sql = new StringBuilder("CASE");
        for (CaseWhenExpression.WhenClause clause : expression.whenClauses()) {
            sql.append(" WHEN ").append(render(clause.condition()))
               .append(" THEN ").append(render(clause.result()));
        }
        if (expression.elseResult() != null) {
            sql.append(" ELSE ").append(render(expression.elseResult()));
        }
        return sql.append(" END").toString();
    }

    @Override
    public String visitRawSQL(RawSQLExpression expression) {
        return expression.sql();
    }

    /**
     * Renders a binary operand, parenthesized when it binds looser than its
     * parent. A right operand of equal precedence keeps its parentheses unless
     * it applies the parent's own associative operator.
     */
    private String renderOperand(Expression operand, BinaryExpression.Operator parent, boolean rightSide) {
        String sql = render(operand);
        if (operand instanceof BinaryExpression) {
            BinaryExpression.Operator operandOperator = ((BinaryExpression) operand).operator();
            int operandPrecedence = precedence(operandOperator);
            int parentPrecedence = precedence(parent);
            if (operandPrecedence < parentPrecedence
                    || (rightSide && operandPrecedence == parentPrecedence
                        && !(operandOperator == parent && isAssociative(parent)))) {
                return "(" + sql + ")";
            }
        }
        return sql;
    }

    private static int precedence(BinaryExpression.Operator operator) {
        switch (operator) {
            case OR:
                return 1;
            case AND:
                return 2;
            case ADD:
            case SUBTRACT:
                return 4;
            case MULTIPLY:
            case DIVIDE:
                return 5;
            default:
                return 3;
        }
    }

    private static boolean isAssociative(BinaryExpression.Operator operator) {
        return operator == BinaryExpression.Operator.ADD
            || operator == BinaryExpression.Operator.MULTIPLY
            || operator == BinaryExpression.Operator.AND
            || operator == BinaryExpression.Operator.OR;
    }
}
