package com.dataflow2sql.expression;

import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Truncation of a temporal value to the start of its enclosing period.
 *
 * <p>The semantics are those of {@link TimeGranularity#truncate}; the SQL text
 * comes from the dialect's date truncation template for the granularity.
 */
public final class DateTruncExpression implements Expression {

    private final TimeGranularity granularity;
    private final Expression argument;

    public DateTruncExpression(TimeGranularity granularity, Expression argument) {
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    public TimeGranularity granularity() {
        return granularity;
    }

    public Expression argument() {
        return argument;
    }

    @Override
    public DataType dataType() {
        return argument.dataType();
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(argument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDateTrunc(this);
    }

    @Override
    public String toString() {
        return "date_trunc(" + granularity.granularityName() + ", " + argument + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DateTruncExpression)) return false;
        DateTruncExpression that = (DateTruncExpression) obj;
        return granularity == that.granularity && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(granularity, argument);
    }
}
