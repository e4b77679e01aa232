package com.dataflow2sql.sql;

/**
 * Join types of the intermediate representation. The keyword spelling of each
 * type is supplied by the dialect profile.
 */
public enum SqlJoinType {
    LEFT_OUTER,
    INNER,
    FULL_OUTER
}
