package com.dataflow2sql.schema;

import com.dataflow2sql.naming.ColumnIdentifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered set of columns produced by a dataflow node.
 *
 * <p>Identifiers and aliases are unique within a schema. The schema is computed
 * from the plan alone, without touching data.
 */
public final class OutputSchema {

    /** Schema with no columns. */
    public static final OutputSchema EMPTY = new OutputSchema(Collections.emptyList());

    private final List<OutputColumn> columns;
    private final Map<ColumnIdentifier, OutputColumn> byIdentifier;

    /**
     * Creates a schema with the given columns in the given order.
     *
     * @param columns the columns
     * @throws IllegalArgumentException if two columns share an identifier or alias
     */
    public OutputSchema(List<OutputColumn> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        this.columns = List.copyOf(columns);
        this.byIdentifier = new HashMap<>();
        Set<String> aliases = new LinkedHashSet<>();
        for (OutputColumn column : this.columns) {
            if (byIdentifier.put(column.identifier(), column) != null || !aliases.add(column.alias())) {
                throw new IllegalArgumentException("Duplicate output column: " + column.alias());
            }
        }
    }

    /**
     * Creates a schema ordered canonically: time dimensions, entities,
     * dimensions, measures, metrics. The order within a kind is preserved.
     *
     * @param columns the columns in their natural order
     * @return the canonically ordered schema
     */
    public static OutputSchema canonical(List<OutputColumn> columns) {
        List<OutputColumn> sorted = new ArrayList<>(columns);
        sorted.sort(Comparator.comparing(OutputColumn::kind));
        return new OutputSchema(sorted);
    }

    public List<OutputColumn> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Returns the column with the given identifier.
     *
     * @param identifier the identifier
     * @return the column, or empty if absent
     */
    public Optional<OutputColumn> find(ColumnIdentifier identifier) {
        return Optional.ofNullable(byIdentifier.get(identifier));
    }

    public boolean contains(ColumnIdentifier identifier) {
        return byIdentifier.containsKey(identifier);
    }

    /**
     * Returns the columns of one kind, in schema order.
     *
     * @param kind the kind
     * @return the matching columns
     */
    public List<OutputColumn> columnsOfKind(ElementKind kind) {
        return columns.stream().filter(c -> c.kind() == kind).collect(Collectors.toList());
    }

    /**
     * Returns the columns a GROUP BY over this schema must list, in schema order.
     *
     * @return the time dimension, entity and dimension columns
     */
    public List<OutputColumn> groupableColumns() {
        return columns.stream().filter(c -> c.kind().isGroupable()).collect(Collectors.toList());
    }

    /**
     * Returns the physical aliases in schema order.
     *
     * @return the aliases
     */
    public List<String> aliases() {
        return columns.stream().map(OutputColumn::alias).collect(Collectors.toList());
    }

    /**
     * Returns the entities an entity path may start with: entities present as
     * columns and the first segment of every qualified column.
     *
     * @return the reachable entity names
     */
    public Set<String> reachableEntities() {
        Set<String> entities = new LinkedHashSet<>();
        for (OutputColumn column : columns) {
            ColumnIdentifier id = column.identifier();
            if (column.kind() == ElementKind.ENTITY && id.entityPath().isEmpty()) {
                entities.add(id.elementName());
            }
            if (!id.entityPath().isEmpty()) {
                entities.add(id.entityPath().get(0));
            }
        }
        return entities;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columns.equals(((OutputSchema) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "OutputSchema(" + aliases() + ")";
    }
}
