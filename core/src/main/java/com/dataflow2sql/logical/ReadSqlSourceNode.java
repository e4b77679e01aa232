package com.dataflow2sql.logical;

import com.dataflow2sql.model.AggregationType;
import com.dataflow2sql.model.DataSource;
import com.dataflow2sql.model.Dimension;
import com.dataflow2sql.model.Entity;
import com.dataflow2sql.model.Measure;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.naming.ColumnNamingResolver;
import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.schema.ElementKind;
import com.dataflow2sql.schema.OutputColumn;
import com.dataflow2sql.schema.OutputSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dataflow node reading every declared element of a data source.
 *
 * <p>Output columns, in order:
 * <ol>
 *   <li>measures</li>
 *   <li>dimensions; each time dimension is followed by its coarser granularity
 *       variants ({@code ds}, {@code ds__week}, ..., {@code ds__year})</li>
 *   <li>for each PRIMARY or UNIQUE entity, the dimensions again, qualified by
 *       that entity ({@code listing__capacity})</li>
 *   <li>the entities</li>
 *   <li>for each PRIMARY or UNIQUE entity, the other entities qualified by it
 *       ({@code listing__user})</li>
 * </ol>
 *
 * <p>SQL generation:
 * <pre>
 * -- Read Elements From Data Source 'listings'
 * SELECT listings_src_0.capacity, ..., DATE_TRUNC(...) AS ds__week, ...
 * FROM db.schema.dim_listings listings_src_0
 * </pre>
 */
public final class ReadSqlSourceNode extends DataflowPlanNode {

    /**
     * How one output column is read from the table.
     *
     * @param column the output column
     * @param expr the backing column or SQL expression; null means the literal {@code 1}
     * @param truncation the granularity to truncate to, or null for the raw value
     */
    public record SourceColumn(OutputColumn column, String expr, TimeGranularity truncation) {
        public SourceColumn {
            Objects.requireNonNull(column, "column must not be null");
        }
    }

    private final DataSource dataSource;
    private final List<SourceColumn> sourceColumns;

    /**
     * Creates a source read node.
     *
     * @param dataSource the data source to read
     */
    public ReadSqlSourceNode(DataSource dataSource) {
        super(Collections.emptyList(), 0);
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.sourceColumns = Collections.unmodifiableList(expandColumns(dataSource));
    }

    public DataSource dataSource() {
        return dataSource;
    }

    /**
     * Returns how each output column is read, in output order.
     *
     * @return the source columns
     */
    public List<SourceColumn> sourceColumns() {
        return sourceColumns;
    }

    @Override
    public int requiredParentCount() {
        return 0;
    }

    @Override
    protected OutputSchema computeOutputSchema() {
        List<OutputColumn> columns = new ArrayList<>(sourceColumns.size());
        for (SourceColumn sourceColumn : sourceColumns) {
            columns.add(sourceColumn.column());
        }
        return new OutputSchema(columns);
    }

    @Override
    public String description() {
        return "Read Elements From Data Source '" + dataSource.name() + "'";
    }

    @Override
    public <R> R accept(DataflowPlanNodeVisitor<R> visitor) {
        return visitor.visitReadSqlSource(this);
    }

    @Override
    public String toString() {
        return String.format("ReadSqlSource(%s, %s)", dataSource.name(), dataSource.sqlTable());
    }

    private static List<SourceColumn> expandColumns(DataSource source) {
        List<SourceColumn> columns = new ArrayList<>();

        for (Measure measure : source.measures()) {
            String expr = measure.expr();
            if (expr == null && measure.aggregation() != AggregationType.COUNT) {
                expr = measure.name();
            }
            columns.add(new SourceColumn(
                OutputColumn.measure(ColumnIdentifier.of(measure.name()), measure.dataType(), measure.aggregation()),
                expr, null));
        }

        addDimensions(columns, source.dimensions(), Collections.emptyList());

        List<Entity> rowEntities = new ArrayList<>();
        for (Entity entity : source.entities()) {
            if (entity.type().identifiesRow()) {
                rowEntities.add(entity);
            }
        }
        for (Entity rowEntity : rowEntities) {
            addDimensions(columns, source.dimensions(), List.of(rowEntity.name()));
        }

        for (Entity entity : source.entities()) {
            columns.add(new SourceColumn(
                OutputColumn.of(ColumnIdentifier.of(entity.name()), ElementKind.ENTITY, entity.dataType()),
                exprOrName(entity.expr(), entity.name()), null));
        }
        for (Entity rowEntity : rowEntities) {
            for (Entity entity : source.entities()) {
                if (entity != rowEntity) {
                    columns.add(new SourceColumn(
                        OutputColumn.of(ColumnIdentifier.of(List.of(rowEntity.name()), entity.name()),
                            ElementKind.ENTITY, entity.dataType()),
                        exprOrName(entity.expr(), entity.name()), null));
                }
            }
        }
        return columns;
    }

    private static void addDimensions(List<SourceColumn> columns, List<Dimension> dimensions, List<String> entityPath) {
        ColumnNamingResolver resolver = ColumnNamingResolver.standard();
        for (Dimension dimension : dimensions) {
            String expr = exprOrName(dimension.expr(), dimension.name());
            ColumnIdentifier base = ColumnIdentifier.of(entityPath, dimension.name());
            if (!dimension.isTime()) {
                columns.add(new SourceColumn(
                    OutputColumn.of(base, ElementKind.DIMENSION, dimension.dataType()), expr, null));
                continue;
            }
            columns.add(new SourceColumn(
                OutputColumn.of(base, ElementKind.TIME_DIMENSION, dimension.dataType()), expr, null));
            for (ColumnIdentifier variant : resolver.granularityVariants(base, dimension.timeGranularity())) {
                columns.add(new SourceColumn(
                    OutputColumn.of(variant, ElementKind.TIME_DIMENSION, dimension.dataType()),
                    expr, variant.granularity().orElseThrow()));
            }
        }
    }

    private static String exprOrName(String expr, String name) {
        return expr != null ? expr : name;
    }
}
