package com.dataflow2sql.model;

/**
 * Roles an entity plays in a data source.
 *
 * <p>PRIMARY and UNIQUE entities identify at most one row of the source, so the
 * source's other elements are also exposed qualified by those entities.
 */
public enum EntityType {
    PRIMARY,
    UNIQUE,
    FOREIGN;

    public boolean identifiesRow() {
        return this == PRIMARY || this == UNIQUE;
    }
}
