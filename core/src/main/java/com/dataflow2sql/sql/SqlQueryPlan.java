package com.dataflow2sql.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A complete SQL query plan: the statement tree produced for one compilation.
 *
 * <p>The plan is immutable and carries no state across compilations.
 */
public final class SqlQueryPlan {

    private final SqlSelectStatement root;

    public SqlQueryPlan(SqlSelectStatement root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public SqlSelectStatement root() {
        return root;
    }

    /**
     * Returns every source alias in the tree, FROM before JOINs, nested
     * aliases before the alias of their enclosing source.
     *
     * @return the aliases in post-order
     */
    public List<String> sourceAliases() {
        List<String> aliases = new ArrayList<>();
        collectAliases(root, aliases);
        return Collections.unmodifiableList(aliases);
    }

    private static void collectAliases(SqlQueryPlanNode node, List<String> aliases) {
        node.accept(new SqlQueryPlanNodeVisitor<Void>() {
            @Override
            public Void visitSelectStatement(SqlSelectStatement statement) {
                collectAliases(statement.fromSource(), aliases);
                aliases.add(statement.fromSourceAlias());
                for (SqlJoinDescription join : statement.joinDescriptions()) {
                    collectAliases(join.right(), aliases);
                    aliases.add(join.rightAlias());
                }
                return null;
            }

            @Override
            public Void visitTableReference(SqlTableReference table) {
                return null;
            }
        });
    }

    @Override
    public String toString() {
        return "SqlQueryPlan(" + root + ")";
    }
}
