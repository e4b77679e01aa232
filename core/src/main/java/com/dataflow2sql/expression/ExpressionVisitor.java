package com.dataflow2sql.expression;

/**
 * Visitor over the closed set of {@link Expression} kinds.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitColumnReference(ColumnReference expression);

    R visitElementReference(ElementReference expression);

    R visitLiteral(Literal expression);

    R visitBinary(BinaryExpression expression);

    R visitUnary(UnaryExpression expression);

    R visitFunctionCall(FunctionCall expression);

    R visitAggregateFunction(AggregateFunction expression);

    R visitDateTrunc(DateTruncExpression expression);

    R visitCast(CastExpression expression);

    R visitCaseWhen(CaseWhenExpression expression);

    R visitRawSQL(RawSQLExpression expression);
}
