package com.dataflow2sql.naming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Maps column identifiers to physical column aliases.
 *
 * <p>The alias joins the entity path and the element name with {@code __} and
 * appends {@code __<granularity>} when the identifier carries one:
 * <pre>
 *   ([], bookings, -)                -- bookings
 *   ([listing], capacity, -)         -- listing__capacity
 *   ([], ds, WEEK)                   -- ds__week
 *   ([listing, user], country, -)    -- listing__user__country
 * </pre>
 *
 * <p>The naming rules enforced by {@link ColumnIdentifier} make this mapping
 * injective, so {@link #parseAlias(String)} recovers the identifier from any
 * alias this resolver produced. The resolver is stateless and thread-safe.
 */
public final class ColumnNamingResolver {

    /** Separator between entity path segments, element name and granularity. */
    public static final String SEPARATOR = "__";

    private static final ColumnNamingResolver STANDARD = new ColumnNamingResolver();

    private ColumnNamingResolver() {}

    /**
     * Returns the standard resolver.
     *
     * @return the shared resolver instance
     */
    public static ColumnNamingResolver standard() {
        return STANDARD;
    }

    /**
     * Resolves the physical alias of a column identifier.
     *
     * @param identifier the identifier
     * @return the alias
     */
    public String resolve(ColumnIdentifier identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        StringBuilder alias = new StringBuilder();
        for (String entity : identifier.entityPath()) {
            alias.append(entity).append(SEPARATOR);
        }
        alias.append(identifier.elementName());
        identifier.granularity().ifPresent(g -> alias.append(SEPARATOR).append(g.granularityName()));
        return alias.toString();
    }

    /**
     * Returns whether a time column declared at {@code declaredGranularity}
     * must be expanded into coarser granularity variants when read.
     *
     * <p>Only base (ungranularized) identifiers are expanded, and only when a
     * coarser granularity exists.
     *
     * @param identifier the time column identifier
     * @param declaredGranularity the granularity of the underlying column
     * @return true if variants must be emitted
     */
    public boolean requiresGranularityExpansion(ColumnIdentifier identifier, TimeGranularity declaredGranularity) {
        Objects.requireNonNull(declaredGranularity, "declaredGranularity must not be null");
        return identifier.granularity().isEmpty() && !declaredGranularity.coarserGranularities().isEmpty();
    }

    /**
     * Enumerates the granularity variants of a base time column, finest first.
     *
     * @param identifier the base time column identifier
     * @param declaredGranularity the granularity of the underlying column
     * @return the variants (empty if no expansion is required)
     */
    public List<ColumnIdentifier> granularityVariants(ColumnIdentifier identifier, TimeGranularity declaredGranularity) {
        if (!requiresGranularityExpansion(identifier, declaredGranularity)) {
            return Collections.emptyList();
        }
        List<ColumnIdentifier> variants = new ArrayList<>();
        for (TimeGranularity granularity : declaredGranularity.coarserGranularities()) {
            variants.add(identifier.withGranularity(granularity));
        }
        return variants;
    }

    /**
     * Recovers the identifier that produced an alias.
     *
     * @param alias an alias produced by {@link #resolve(ColumnIdentifier)}
     * @return the identifier
     * @throws IllegalArgumentException if the alias cannot have been produced by this resolver
     */
    public ColumnIdentifier parseAlias(String alias) {
        Objects.requireNonNull(alias, "alias must not be null");
        List<String> segments = new ArrayList<>(Arrays.asList(alias.split(SEPARATOR, -1)));
        TimeGranularity granularity = null;
        String last = segments.get(segments.size() - 1);
        if (segments.size() > 1 && TimeGranularity.isGranularityName(last)) {
            granularity = TimeGranularity.parse(last);
            segments.remove(segments.size() - 1);
        }
        String elementName = segments.remove(segments.size() - 1);
        return new ColumnIdentifier(segments, elementName, granularity);
    }
}
