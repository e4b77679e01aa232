package com.dataflow2sql.expression;

import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reference to a dataflow column by its logical identifier.
 *
 * <p>Element references appear only in expressions authored against a dataflow
 * node (constraint predicates, derived metric formulas). Lowering replaces each
 * one with a {@link ColumnReference} to the resolved alias, so a rendered plan
 * never contains them.
 *
 * <p>Example:
 * <pre>
 *   BinaryExpression.greaterThan(
 *       ElementReference.of(List.of("listing"), "capacity"), Literal.of(2))
 * </pre>
 */
public final class ElementReference implements Expression {

    private final ColumnIdentifier identifier;

    public ElementReference(ColumnIdentifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
    }

    public ColumnIdentifier identifier() {
        return identifier;
    }

    @Override
    public DataType dataType() {
        return UnresolvedType.get();
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitElementReference(this);
    }

    @Override
    public String toString() {
        return "element(" + identifier + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ElementReference && identifier.equals(((ElementReference) obj).identifier);
    }

    @Override
    public int hashCode() {
        return identifier.hashCode();
    }

    public static ElementReference of(String elementName) {
        return new ElementReference(ColumnIdentifier.of(elementName));
    }

    public static ElementReference of(List<String> entityPath, String elementName) {
        return new ElementReference(ColumnIdentifier.of(entityPath, elementName));
    }
}
