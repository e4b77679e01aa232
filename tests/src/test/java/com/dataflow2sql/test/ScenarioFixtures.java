package com.dataflow2sql.test;

import com.dataflow2sql.expression.BinaryExpression;
import com.dataflow2sql.expression.ElementReference;
import com.dataflow2sql.expression.Literal;
import com.dataflow2sql.logical.AggregateMeasuresNode;
import com.dataflow2sql.logical.ComputeMetricsNode;
import com.dataflow2sql.logical.ComputeMetricsNode.MetricSpec;
import com.dataflow2sql.logical.ConstrainOutputNode;
import com.dataflow2sql.logical.DataflowPlanNode;
import com.dataflow2sql.logical.FilterElementsNode;
import com.dataflow2sql.logical.JoinOnEntitiesNode;
import com.dataflow2sql.logical.MetricTimeDimensionTransformNode;
import com.dataflow2sql.logical.ReadSqlSourceNode;
import com.dataflow2sql.model.AggregationType;
import com.dataflow2sql.model.DataSource;
import com.dataflow2sql.model.Dimension;
import com.dataflow2sql.model.DimensionType;
import com.dataflow2sql.model.Entity;
import com.dataflow2sql.model.EntityType;
import com.dataflow2sql.model.Measure;
import com.dataflow2sql.naming.ColumnIdentifier;
import com.dataflow2sql.naming.TimeGranularity;
import com.dataflow2sql.types.BooleanType;
import com.dataflow2sql.types.DateType;
import com.dataflow2sql.types.DoubleType;
import com.dataflow2sql.types.IntegerType;
import com.dataflow2sql.types.LongType;
import com.dataflow2sql.types.StringType;
import java.util.ArrayList;
import java.util.List;

/**
 * Semantic model and dataflow plans shared by the tests: a bookings fact
 * source and a listings dimension source whose rows are valid over a window.
 */
public final class ScenarioFixtures {

    /** Schema used by golden files. */
    public static final String GOLDEN_SCHEMA = "db.schema";

    private ScenarioFixtures() {}

    public static DataSource bookingsSource(String schema) {
        return new DataSource("bookings_source", schema + ".fct_bookings",
            List.of(
                new Measure("bookings", "1", AggregationType.SUM, LongType.get()),
                new Measure("instant_bookings", "is_instant", AggregationType.SUM_BOOLEAN, BooleanType.get()),
                new Measure("booking_value", null, AggregationType.SUM, DoubleType.get()),
                new Measure("bookers", "guest_id", AggregationType.COUNT_DISTINCT, LongType.get()),
                new Measure("average_booking_value", "booking_value", AggregationType.AVERAGE, DoubleType.get())),
            List.of(
                new Dimension("is_instant", null, DimensionType.CATEGORICAL, null, BooleanType.get()),
                new Dimension("ds", null, DimensionType.TIME, TimeGranularity.DAY, DateType.get())),
            List.of(
                new Entity("listing", "listing_id", EntityType.FOREIGN, LongType.get()),
                new Entity("guest", "guest_id", EntityType.FOREIGN, LongType.get()),
                new Entity("host", "host_id", EntityType.FOREIGN, LongType.get())));
    }

    public static DataSource listingsSource(String schema) {
        return new DataSource("listings", schema + ".dim_listings",
            List.of(),
            List.of(
                new Dimension("window_start", "active_from", DimensionType.TIME, TimeGranularity.DAY, DateType.get()),
                new Dimension("window_end", "active_to", DimensionType.TIME, TimeGranularity.DAY, DateType.get()),
                new Dimension("country", null, DimensionType.CATEGORICAL, null, StringType.get()),
                new Dimension("capacity", null, DimensionType.CATEGORICAL, null, IntegerType.get())),
            List.of(
                new Entity("listing", "listing_id", EntityType.PRIMARY, LongType.get()),
                new Entity("user", "user_id", EntityType.FOREIGN, LongType.get())));
    }

    /**
     * Builds the validity-window scenario: bookings joined to the listing row
     * valid at booking time, restricted to listings with capacity above
     * {@code minCapacity}, summed by metric time and exposed as
     * {@code family_bookings}.
     *
     * @param schema the schema holding both tables
     * @param minCapacity the exclusive capacity bound
     * @return the sink of the plan
     */
    public static DataflowPlanNode joinToScdDimensionPlan(String schema, long minCapacity) {
        DataflowPlanNode bookings = bookingsWithListingCapacity(schema, List.of("bookings"));
        DataflowPlanNode constrained = new ConstrainOutputNode(bookings,
            BinaryExpression.greaterThan(
                ElementReference.of(List.of("listing"), "capacity"), Literal.of(minCapacity)));
        DataflowPlanNode pruned = new FilterElementsNode(constrained,
            ids("bookings", "metric_time"));
        DataflowPlanNode aggregated = new AggregateMeasuresNode(pruned);
        return new ComputeMetricsNode(aggregated, List.of(MetricSpec.proxy("family_bookings", "bookings")));
    }

    public static DataflowPlanNode joinToScdDimensionPlan() {
        return joinToScdDimensionPlan(GOLDEN_SCHEMA, 2);
    }

    /**
     * Reads the given bookings measures with metric time and joins the listing
     * capacity valid at booking time. The output holds the measures,
     * {@code listing__capacity} and {@code metric_time}.
     */
    public static DataflowPlanNode bookingsWithListingCapacity(String schema, List<String> measures) {
        List<String> left = new ArrayList<>(measures);
        left.add("metric_time");
        left.add("listing");
        DataflowPlanNode bookings = new FilterElementsNode(
            new MetricTimeDimensionTransformNode(new ReadSqlSourceNode(bookingsSource(schema)), "ds"),
            ids(left.toArray(new String[0])));
        DataflowPlanNode listings = new FilterElementsNode(
            new ReadSqlSourceNode(listingsSource(schema)),
            ids("listing", "window_start", "window_end", "capacity"));
        DataflowPlanNode joined = JoinOnEntitiesNode.onEntity(bookings, listings, "listing",
            new JoinOnEntitiesNode.ValidityWindow(
                ColumnIdentifier.of("metric_time"),
                ColumnIdentifier.of("window_start"),
                ColumnIdentifier.of("window_end")));
        List<ColumnIdentifier> kept = new ArrayList<>(ids(measures.toArray(new String[0])));
        kept.add(ColumnIdentifier.of(List.of("listing"), "capacity"));
        kept.add(ColumnIdentifier.of("metric_time"));
        return new FilterElementsNode(joined, kept);
    }

    /**
     * Reads bookings, exposes metric time at the given granularity and keeps
     * the given measures.
     */
    public static DataflowPlanNode bookingsByMetricTime(String schema, TimeGranularity granularity,
                                                        List<String> measures) {
        List<ColumnIdentifier> kept = new ArrayList<>(ids(measures.toArray(new String[0])));
        kept.add(ColumnIdentifier.metricTime(granularity == TimeGranularity.DAY ? null : granularity));
        return new FilterElementsNode(
            new MetricTimeDimensionTransformNode(new ReadSqlSourceNode(bookingsSource(schema)), "ds"),
            kept);
    }

    public static List<ColumnIdentifier> ids(String... names) {
        List<ColumnIdentifier> ids = new ArrayList<>();
        for (String name : names) {
            ids.add(ColumnIdentifier.of(name));
        }
        return ids;
    }
}
