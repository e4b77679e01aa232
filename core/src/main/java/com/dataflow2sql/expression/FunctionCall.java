package com.dataflow2sql.expression;

import com.dataflow2sql.types.DataType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a scalar function call that every supported dialect
 * spells the same way, such as {@code NULLIF} or {@code COALESCE}.
 *
 * <p>Functions whose spelling differs across warehouses get their own
 * expression kind ({@link DateTruncExpression}, {@link CastExpression}) so the
 * difference is handled by the dialect profile.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name, rendered verbatim
     * @param arguments the function arguments
     * @param dataType the return data type
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType);
    }

    /**
     * Creates {@code NULLIF(value, nullValue)}.
     *
     * @param value the value
     * @param nullValue the value mapped to NULL
     * @return the function call
     */
    public static FunctionCall nullIf(Expression value, Expression nullValue) {
        return new FunctionCall("NULLIF", Arrays.asList(value, nullValue), value.dataType());
    }
}
