/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.CensorKind;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.Observation;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Turns caller input into the time-sorted series the engine works on.
 *
 * <p>Observations without a finite time or face value are dropped. The sort is stable, so
 * observations sharing a timestamp keep their input order. When the hicensor rule is
 * enabled every value below the highest left-censor limit is re-censored at that limit.
 */
@ApplicationScoped
public class SeriesPreparationService {

    private static final Logger LOG = Logger.getLogger(SeriesPreparationService.class);

    /**
     * Prepared series with the count of dropped input rows.
     *
     * @param observations time-sorted, finite observations
     * @param dropped      input rows removed for a non-finite time or value
     */
    public record PreparedSeries(List<Observation> observations, int dropped) {

        public PreparedSeries {
            observations = List.copyOf(observations);
        }

        public int size() {
            return observations.size();
        }

        public long distinctTimes() {
            return observations.stream().mapToDouble(o -> o.time() + 0.0).distinct().count();
        }
    }

    /**
     * Builds observations from parallel arrays. For censored entries the value is read as
     * the detection limit.
     *
     * @param times  time axis
     * @param values values or detection limits
     * @param kinds  censoring state per entry, {@code null} for an uncensored series
     * @throws IllegalArgumentException if the array lengths differ
     */
    public List<Observation> fromArrays(double[] times, double[] values, CensorKind[] kinds) {
        if (times == null || values == null) {
            throw new IllegalArgumentException("times and values must not be null");
        }
        if (times.length != values.length || (kinds != null && kinds.length != values.length)) {
            throw new IllegalArgumentException(String.format(
                    "Array lengths differ: times=%d, values=%d, censor kinds=%d",
                    times.length, values.length, kinds == null ? values.length : kinds.length));
        }
        List<Observation> observations = new ArrayList<>(times.length);
        for (int i = 0; i < times.length; i++) {
            CensorKind kind = kinds == null || kinds[i] == null ? CensorKind.NONE : kinds[i];
            observations.add(kind == CensorKind.NONE
                    ? Observation.of(times[i], values[i])
                    : Observation.censored(times[i], values[i], kind));
        }
        return observations;
    }

    /**
     * Drops non-finite rows, sorts by time and applies the hicensor rule.
     *
     * @param input  caller observations in any order
     * @param config analysis settings
     * @return the prepared series
     */
    public PreparedSeries prepare(List<Observation> input, AnalysisConfig config) {
        if (input == null) {
            throw new IllegalArgumentException("Observation list must not be null");
        }
        List<Observation> finite = new ArrayList<>(input.size());
        for (Observation observation : input) {
            if (observation != null && observation.isFinite()) {
                finite.add(observation);
            }
        }
        int dropped = input.size() - finite.size();
        if (dropped > 0) {
            LOG.debugf("Dropped %d observations with non-finite time or value", dropped);
        }

        finite.sort(Comparator.comparingDouble(Observation::time));

        List<Observation> series = config.isHicensor() ? applyHicensor(finite, config.getHicensorLimit()) : finite;
        return new PreparedSeries(series, dropped);
    }

    /**
     * Re-censors every uncensored value below the limit, and every left-censored value with
     * a lower limit, as {@code LEFT(limit)}.
     *
     * @param series time-sorted observations
     * @param explicitLimit limit to use, or {@code null} for the highest left-censor limit of the series
     * @return the re-censored series; unchanged when no limit applies
     */
    public List<Observation> applyHicensor(List<Observation> series, Double explicitLimit) {
        double limit = explicitLimit != null ? explicitLimit : series.stream()
                .filter(o -> o.censorKind() == CensorKind.LEFT)
                .mapToDouble(Observation::detectionLimit)
                .max()
                .orElse(Double.NaN);
        if (Double.isNaN(limit)) {
            return series;
        }

        int changed = 0;
        List<Observation> result = new ArrayList<>(series.size());
        for (Observation o : series) {
            boolean below = switch (o.censorKind()) {
                case NONE -> o.value() < limit;
                case LEFT -> o.detectionLimit() < limit;
                case RIGHT -> false;
            };
            if (below) {
                result.add(Observation.leftCensored(o.time(), limit));
                changed++;
            } else {
                result.add(o);
            }
        }
        LOG.debugf("hicensor at %.6g re-censored %d observations", limit, changed);
        return result;
    }

    /** Number of distinct (kind, limit) censor levels in the series. */
    public int uniqueCensorLevels(List<Observation> series) {
        Set<String> levels = new HashSet<>();
        for (Observation o : series) {
            if (o.isCensored()) {
                levels.add(o.censorKind().name() + ":" + (o.detectionLimit() + 0.0));
            }
        }
        return levels.size();
    }

    /** Number of distinct (kind, face value) reports in the series. */
    public static int uniqueReports(List<Observation> series) {
        Set<String> reports = new HashSet<>();
        for (Observation o : series) {
            reports.add(o.censorKind().name() + ":" + (o.faceValue() + 0.0));
        }
        return reports.size();
    }
}
