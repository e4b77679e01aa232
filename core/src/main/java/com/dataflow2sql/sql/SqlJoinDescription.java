package com.dataflow2sql.sql;

import com.dataflow2sql.expression.Expression;
import java.util.Objects;

/**
 * A JOIN of a nested source to the statement's FROM source.
 *
 * @param right the joined source, owned by the enclosing statement
 * @param rightAlias the alias of the joined source
 * @param joinType the join type
 * @param onCondition the ON condition
 */
public record SqlJoinDescription(SqlQueryPlanNode right, String rightAlias, SqlJoinType joinType,
                                 Expression onCondition) {

    public SqlJoinDescription {
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(rightAlias, "rightAlias must not be null");
        Objects.requireNonNull(joinType, "joinType must not be null");
        Objects.requireNonNull(onCondition, "onCondition must not be null");
    }
}
