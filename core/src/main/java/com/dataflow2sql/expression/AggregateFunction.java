package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.LongType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an aggregate function applied to one argument.
 *
 * <p>Examples:
 * <pre>
 *   SUM(subq_8.bookings)
 *   COUNT(DISTINCT subq_8.guest)
 *   AVG(subq_8.booking_value)
 * </pre>
 *
 * <p>{@code COUNT(DISTINCT ...)} is a dialect capability: rendering it for a
 * dialect without native support fails with
 * {@link com.dataflow2sql.exception.UnsupportedConstructException}.
 */
public final class AggregateFunction implements Expression {

    /**
     * Aggregate functions of the intermediate representation.
     */
    public enum Function {
        SUM,
        COUNT,
        MIN,
        MAX,
        AVG
    }

    private final Function function;
    private final boolean distinct;
    private final Expression argument;

    public AggregateFunction(Function function, boolean distinct, Expression argument) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
        this.distinct = distinct;
    }

    public AggregateFunction(Function function, Expression argument) {
        this(function, false, argument);
    }

    public Function function() {
        return function;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public Expression argument() {
        return argument;
    }

    @Override
    public DataType dataType() {
        switch (function) {
            case COUNT:
                return LongType.get();
            case AVG:
                return DoubleType.get();
            default:
                return argument.dataType();
        }
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(argument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAggregateFunction(this);
    }

    @Override
    public String toString() {
        return function + "(" + (distinct ? "DISTINCT " : "") + argument + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateFunction)) return false;
        AggregateFunction that = (AggregateFunction) obj;
        return function == that.function && distinct == that.distinct && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, distinct, argument);
    }
}
