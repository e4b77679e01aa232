package com.dataflow2sql.expression;

import com.dataflow2sql.types.BooleanType;
import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.DateType;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.LongType;
import com.dataflow2sql.types.StringType;
import com.dataflow2sql.types.UnresolvedType;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Supported values are {@link Long}, {@link Double}, {@link String},
 * {@link Boolean}, {@link LocalDate} and null.
 *
 * <p>Examples in SQL:
 * <pre>
 *   1                    -- long literal
 *   'US'                 -- string literal
 *   TRUE                 -- boolean literal
 *   DATE '2020-01-01'    -- date literal
 *   NULL                 -- null literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     * @throws IllegalArgumentException if value is NaN or infinite
     */
    public Literal(Object value, DataType dataType) {
        if ((value instanceof Double || value instanceof Float)
                && !Double.isFinite(((Number) value).doubleValue())) {
            throw new IllegalArgumentException("Literal must be a finite number: " + value);
        }
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(Objects.requireNonNull(value, "value must not be null"), StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    public static Literal of(LocalDate value) {
        return new Literal(Objects.requireNonNull(value, "value must not be null"), DateType.get());
    }

    public static Literal nullValue() {
        return new Literal(null, UnresolvedType.get());
    }
}
