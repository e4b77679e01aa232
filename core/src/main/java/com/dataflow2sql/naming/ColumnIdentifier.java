package com.dataflow2sql.naming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Logical name of a column flowing through a dataflow plan.
 *
 * <p>An identifier is the triple (entity path, element name, granularity). Two
 * identifiers are equal iff all three parts are equal. The physical alias is
 * derived by {@link ColumnNamingResolver}.
 *
 * <p>Names are restricted so that aliases stay injective, also in warehouses
 * that fold unquoted identifiers to one case: every entity and element name is
 * made of lower-case letters, digits and single underscores, does not start or
 * end with an underscore, and is not a granularity name.
 *
 * <p>Examples:
 * <pre>
 *   ColumnIdentifier.of("bookings")                                  -- bookings
 *   ColumnIdentifier.of(List.of("listing"), "capacity")              -- listing__capacity
 *   ColumnIdentifier.of("ds").withGranularity(TimeGranularity.WEEK)  -- ds__week
 * </pre>
 */
public final class ColumnIdentifier {

    /** Element name of the metric time dimension. */
    public static final String METRIC_TIME = "metric_time";

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z0-9]+(_[a-z0-9]+)*");

    private final List<String> entityPath;
    private final String elementName;
    private final TimeGranularity granularity;

    /**
     * Creates a column identifier.
     *
     * @param entityPath the entity names leading to the element (may be empty)
     * @param elementName the element name
     * @param granularity the time granularity (null for the base column)
     * @throws IllegalArgumentException if a name violates the naming rules
     */
    public ColumnIdentifier(List<String> entityPath, String elementName, TimeGranularity granularity) {
        Objects.requireNonNull(entityPath, "entityPath must not be null");
        this.elementName = checkName(Objects.requireNonNull(elementName, "elementName must not be null"));
        List<String> path = new ArrayList<>(entityPath.size());
        for (String entity : entityPath) {
            path.add(checkName(Objects.requireNonNull(entity, "entity name must not be null")));
        }
        this.entityPath = Collections.unmodifiableList(path);
        this.granularity = granularity;
    }

    /**
     * Returns the entity path, outermost entity first.
     *
     * @return an unmodifiable list of entity names
     */
    public List<String> entityPath() {
        return entityPath;
    }

    /**
     * Returns the element name.
     *
     * @return the element name
     */
    public String elementName() {
        return elementName;
    }

    /**
     * Returns the time granularity.
     *
     * @return the granularity, or empty for an ungranularized column
     */
    public Optional<TimeGranularity> granularity() {
        return Optional.ofNullable(granularity);
    }

    /**
     * Returns a copy with the given granularity.
     *
     * @param newGranularity the granularity (null to drop it)
     * @return the new identifier
     */
    public ColumnIdentifier withGranularity(TimeGranularity newGranularity) {
        return new ColumnIdentifier(entityPath, elementName, newGranularity);
    }

    /**
     * Returns a copy whose entity path is {@code prefix} followed by this path.
     *
     * @param prefix the entity names to prepend
     * @return the new identifier
     */
    public ColumnIdentifier withEntityPrefix(List<String> prefix) {
        List<String> path = new ArrayList<>(prefix);
        path.addAll(entityPath);
        return new ColumnIdentifier(path, elementName, granularity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnIdentifier)) return false;
        ColumnIdentifier that = (ColumnIdentifier) obj;
        return entityPath.equals(that.entityPath) &&
               elementName.equals(that.elementName) &&
               granularity == that.granularity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityPath, elementName, granularity);
    }

    @Override
    public String toString() {
        return ColumnNamingResolver.standard().resolve(this);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an identifier with an empty entity path.
     *
     * @param elementName the element name
     * @return the identifier
     */
    public static ColumnIdentifier of(String elementName) {
        return new ColumnIdentifier(Collections.emptyList(), elementName, null);
    }

    /**
     * Creates an entity-qualified identifier.
     *
     * @param entityPath the entity path
     * @param elementName the element name
     * @return the identifier
     */
    public static ColumnIdentifier of(List<String> entityPath, String elementName) {
        return new ColumnIdentifier(entityPath, elementName, null);
    }

    /**
     * Creates the identifier of the metric time column at a granularity.
     *
     * @param granularity the granularity (null for the base column)
     * @return the identifier
     */
    public static ColumnIdentifier metricTime(TimeGranularity granularity) {
        return new ColumnIdentifier(Collections.emptyList(), METRIC_TIME, granularity);
    }

    private static String checkName(String name) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                "Invalid element or entity name '" + name + "': use lower-case letters, digits and "
                + "single underscores, without leading or trailing underscores");
        }
        if (TimeGranularity.isGranularityName(name)) {
            throw new IllegalArgumentException(
                "Element or entity name '" + name + "' is reserved as a granularity suffix");
        }
        return name;
    }
}
