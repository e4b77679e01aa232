package com.dataflow2sql.logical;

import com.dataflow2sql.exception.MalformedPlanException;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import com.dataflow2sql.sql.SqlJoinType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Dataflow node joining two inputs on equality of entity columns.
 *
 * <p>Left columns keep their identifiers. Right columns, except the right join
 * keys, are re-identified under the right entity prefix ({@code capacity}
 * becomes {@code listing__capacity}). The right input must not carry measures.
 *
 * <p>When a {@link ValidityWindow} is given, a left row only matches right rows
 * whose window contains the left row's time:
 * <pre>
 *   left.ts &gt;= right.window_start AND (left.ts &lt; right.window_end OR right.window_end IS NULL)
 * </pre>
 */
public final class JoinOnEntitiesNode extends DataflowPlanNode {

    /**
     * An equality condition between a left and a right column.
     *
     * @param leftColumn the left column
     * @param rightColumn the right column, as named by the right input
     */
    public record JoinKey(ColumnIdentifier leftColumn, ColumnIdentifier rightColumn) {
        public JoinKey {
            Objects.requireNonNull(leftColumn, "leftColumn must not be null");
            Objects.requireNonNull(rightColumn, "rightColumn must not be null");
        }
    }

    /**
     * The effective interval of right rows, {@code [windowStart, windowEnd)}.
     *
     * @param leftTime the left time column matched against the window
     * @param windowStart the right column holding the inclusive start
     * @param windowEnd the right column holding the exclusive end (NULL while current)
     */
    public record ValidityWindow(ColumnIdentifier leftTime, ColumnIdentifier windowStart,
                                 ColumnIdentifier windowEnd) {
        public ValidityWindow {
            Objects.requireNonNull(leftTime, "leftTime must not be null");
            Objects.requireNonNull(windowStart, "windowStart must not be null");
            Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        }
    }

    private final List<JoinKey> joinKeys;
    private final List<String> rightEntityPrefix;
    private final ValidityWindow validityWindow;
    private final SqlJoinType joinType;

    /**
     * Creates a join node.
     *
     * @param left the left input
     * @param right the right input
     * @param joinKeys the equality conditions (at least one)
     * @param rightEntityPrefix the entity path prefixed to right columns
     * @param validityWindow the validity window, or null
     * @param joinType the join type
     */
    public JoinOnEntitiesNode(DataflowPlanNode left, DataflowPlanNode right, List<JoinKey> joinKeys,
                              List<String> rightEntityPrefix, ValidityWindow validityWindow,
                              SqlJoinType joinType) {
        super(Arrays.asList(left, right), 2);
        Objects.requireNonNull(joinKeys, "joinKeys must not be null");
        Objects.requireNonNull(rightEntityPrefix, "rightEntityPrefix must not be null");
        if (joinKeys.isEmpty()) {
            throw new MalformedPlanException("Join requires at least one entity key", null);
        }
        this.joinKeys = List.copyOf(joinKeys);
        this.rightEntityPrefix = List.copyOf(rightEntityPrefix);
        this.validityWindow = validityWindow;
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
    }

    /**
     * Creates a LEFT OUTER join on one entity present on both sides, prefixing
     * right columns with that entity.
     *
     * @param left the left input
     * @param right the right input
     * @param entity the entity name
     * @param validityWindow the validity window, or null
     * @return the join node
     */
    public static JoinOnEntitiesNode onEntity(DataflowPlanNode left, DataflowPlanNode right, String entity,
                                              ValidityWindow validityWindow) {
        ColumnIdentifier key = ColumnIdentifier.of(entity);
        return new JoinOnEntitiesNode(left, right, List.of(new JoinKey(key, key)), List.of(entity),
            validityWindow, SqlJoinType.LEFT_OUTER);
    }

    public DataflowPlanNode left() {
        return parentNodes().get(0);
    }

    public DataflowPlanNode right() {
        return parentNodes().get(1);
    }

    public List<JoinKey> joinKeys() {
        return joinKeys;
    }

    public List<String> rightEntityPrefix() {
        return rightEntityPrefix;
    }

    /**
     * Returns the validity window condition.
     *
     * @return the window, or null for a plain entity join
     */
    public ValidityWindow validityWindow() {
        return validityWindow;
    }

    public SqlJoinType joinType() {
        return joinType;
    }

    /**
     * Returns whether a right column is dropped from the output because it is a join key.
     *
     * @param rightColumn the right column identifier
     * @return true for right join keys
     */
    public boolean isRightJoinKey(ColumnIdentifier rightColumn) {
        for (JoinKey key : joinKeys) {
            if (key.rightColumn().equals(rightColumn)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the identifier a right column takes in the output.
     *
     * @param rightColumn the right column identifier
     * @return the prefixed identifier
     */
    public ColumnIdentifier prefixedRightIdentifier(ColumnIdentifier rightColumn) {
        return rightColumn.withEntityPrefix(rightEntityPrefix);
    }

    @Override
    public int requiredParentCount() {
        return 2;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        OutputSchema leftSchema = left().outputSchema();
        OutputSchema rightSchema = right().outputSchema();

        for (JoinKey key : joinKeys) {
            requireColumn(leftSchema, key.leftColumn(), "left");
            requireColumn(rightSchema, key.rightColumn(), "right");
        }
        if (validityWindow != null) {
            requireColumn(leftSchema, validityWindow.leftTime(), "left");
            requireColumn(rightSchema, validityWindow.windowStart(), "right");
            requireColumn(rightSchema, validityWindow.windowEnd(), "right");
        }

        List<OutputColumn> columns = new ArrayList<>(leftSchema.columns());
        Set<String> aliases = new HashSet<>(leftSchema.aliases());
        for (OutputColumn column : rightSchema.columns()) {
            if (column.kind() == ElementKind.MEASURE || column.kind() == ElementKind.METRIC) {
                throw new MalformedPlanException(
                    "Right side of a join must not carry measures or metrics: " + column.alias(), this);
            }
            if (isRightJoinKey(column.identifier())) {
                continue;
            }
            OutputColumn prefixed = column.withIdentifier(prefixedRightIdentifier(column.identifier()));
            if (!aliases.add(prefixed.alias())) {
                throw new MalformedPlanException(
                    "Right column '" + column.alias() + "' collides with '" + prefixed.alias() + "'", this);
            }
            columns.add(prefixed);
        }
        return OutputSchema.canonical(columns);
    }

    private void requireColumn(OutputSchema schema, ColumnIdentifier id, String side) {
        if (!schema.contains(id)) {
            throw new MalformedPlanException("The " + side + " input does not contain '" + id + "'", this);
        }
    }

    @Override
    public String description() {
        return "Join Standard Outputs";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitJoinOnEntities(this);
    }

    @Override
    public String toString() {
        return String.format("JoinOnEntities(%s, keys=%s, window=%s)", joinType, joinKeys, validityWindow);
    }
}
