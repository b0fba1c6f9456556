/* (C)2026 */
package com.ammann.trend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ordered threshold table mapping a lower confidence bound to a label.
 *
 * <p>The default table follows the IPCC likelihood ladder.
 */
public final class ConfidenceCategories
{
    public static final ConfidenceCategories DEFAULT = new ConfidenceCategories(defaultTable());

    private final NavigableMap<Double, String> thresholds;

    private ConfidenceCategories(NavigableMap<Double, String> thresholds)
    {
        this.thresholds = Collections.unmodifiableNavigableMap(thresholds);
    }

    /**
     * Builds a table from caller-supplied thresholds.
     *
     * @param table lower bound to label; bounds must lie in [0, 1]
     * @throws IllegalArgumentException if the table is empty or a bound is out of range
     */
    public static ConfidenceCategories of(Map<Double, String> table)
    {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Category table must contain at least one threshold");
        }
        TreeMap<Double, String> sorted = new TreeMap<>();
        for (Map.Entry<Double, String> entry : table.entrySet()) {
            Double bound = entry.getKey();
            if (bound == null || !(bound >= 0.0 && bound <= 1.0)) {
                throw new IllegalArgumentException("Category threshold must lie in [0, 1], got " + bound);
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException("Category label for threshold " + bound + " must not be blank");
            }
            sorted.put(bound, entry.getValue().trim());
        }
        return new ConfidenceCategories(sorted);
    }

    /**
     * Label of the highest threshold not above {@code confidence}.
     *
     * @return the label, or empty when the confidence lies below every threshold
     */
    public Optional<String> labelFor(double confidence)
    {
        Map.Entry<Double, String> entry = thresholds.floorEntry(confidence);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    /** Thresholds from highest to lowest. */
    public Map<Double, String> asMap()
    {
        return new LinkedHashMap<>(thresholds.descendingMap());
    }

    private static NavigableMap<Double, String> defaultTable()
    {
        TreeMap<Double, String> table = new TreeMap<>();
        table.put(0.95, "Highly Likely");
        table.put(0.90, "Very Likely");
        table.put(0.67, "Likely");
        table.put(0.0, "As Likely as Not");
        return table;
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof ConfidenceCategories other && thresholds.equals(other.thresholds);
    }

    @Override
    public int hashCode()
    {
        return thresholds.hashCode();
    }

    @Override
    public String toString()
    {
        return "ConfidenceCategories" + asMap();
    }
}
