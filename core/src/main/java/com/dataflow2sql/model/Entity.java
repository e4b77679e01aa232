package com.dataflow2sql.model;

import com.dataflow2sql.types.DataType;
import com.dataflow2sql.types.UnresolvedType;
import java.util.Objects;

/**
 * An entity (join key) declared by a data source.
 *
 * @param name the entity name
 * @param expr the backing column or SQL expression (may be null)
 * @param type the entity role
 * @param dataType the key type
 */
public record Entity(String name, String expr, EntityType type, DataType dataType) {

    public Entity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public Entity(String name, String expr, EntityType type) {
        this(name, expr, type, UnresolvedType.get());
    }
}
