/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.model.ConfidenceCategories;
import com.ammann.trend.model.TrendResult;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Maps a confidence value to a likelihood label followed by the direction word, for
 * example {@code "Very Likely Decreasing"}.
 *
 * <p>Stateless; a finished {@link TrendResult} can be re-classified with another table
 * independently of the alpha it was computed with.
 */
@ApplicationScoped
public class TrendClassifier {

    public static final String NO_TREND = TrendDirection.NONE.getLabel();

    public String classify(double confidence, TrendDirection direction, ConfidenceCategories categories) {
        if (Double.isNaN(confidence)) {
            return TrendResult.INSUFFICIENT_DATA;
        }
        if (direction == null || direction == TrendDirection.NONE) {
            return NO_TREND;
        }
        ConfidenceCategories table = categories == null ? ConfidenceCategories.DEFAULT : categories;
        return table.labelFor(confidence)
                .map(label -> label + " " + direction.getLabel())
                .orElse(NO_TREND);
    }

    public String classify(TrendResult result, ConfidenceCategories categories) {
        return classify(result.confidence(), result.direction(), categories);
    }

    public String classify(TrendResult result) {
        return classify(result, ConfidenceCategories.DEFAULT);
    }
}
