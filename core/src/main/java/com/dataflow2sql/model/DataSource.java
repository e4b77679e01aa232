package com.dataflow2sql.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A table or view of the semantic model with its declared elements.
 *
 * <p>Data sources are produced by the semantic model collaborator; the compiler
 * only reads them. Element names must be unique within a source.
 *
 * @param name the data source name
 * @param sqlTable the fully qualified table name, e.g. {@code db.schema.fct_bookings}
 * @param measures the measures, in declaration order
 * @param dimensions the dimensions, in declaration order
 * @param entities the entities, in declaration order
 */
public record DataSource(String name, String sqlTable, List<Measure> measures,
                         List<Dimension> dimensions, List<Entity> entities) {

    public DataSource {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sqlTable, "sqlTable must not be null");
        measures = List.copyOf(Objects.requireNonNull(measures, "measures must not be null"));
        dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions must not be null"));
        entities = List.copyOf(Objects.requireNonNull(entities, "entities must not be null"));

        Set<String> names = new HashSet<>();
        measures.forEach(m -> checkUnique(names, m.name(), name));
        dimensions.forEach(d -> checkUnique(names, d.name(), name));
        entities.forEach(e -> checkUnique(names, e.name(), name));
    }

    private static void checkUnique(Set<String> names, String element, String source) {
        if (!names.add(element)) {
            throw new IllegalArgumentException(
                "Element '" + element + "' is declared more than once in data source '" + source + "'");
        }
    }
}
