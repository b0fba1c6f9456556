/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.CensorKind;

/**
 * One sample of a time series.
 *
 * <p>For uncensored samples {@code detectionLimit == value}. For censored samples the value
 * is undefined ({@code NaN}) and {@code detectionLimit} carries the reported bound. The
 * censoring decision is taken once, when the observation is built, and never re-derived.
 *
 * @param time           numeric time (seconds since the epoch for calendar seasons)
 * @param value          measured value, {@code NaN} when censored
 * @param censorKind     censoring state
 * @param detectionLimit reported bound, equal to {@code value} when uncensored
 */
public record Observation(double time, double value, CensorKind censorKind, double detectionLimit) {

    public Observation {
        if (censorKind == null) {
            throw new IllegalArgumentException("censorKind must not be null");
        }
        if (censorKind == CensorKind.NONE) {
            detectionLimit = value;
        } else {
            value = Double.NaN;
        }
    }

    public static Observation of(double time, double value) {
        return new Observation(time, value, CensorKind.NONE, value);
    }

    public static Observation leftCensored(double time, double limit) {
        return new Observation(time, Double.NaN, CensorKind.LEFT, limit);
    }

    public static Observation rightCensored(double time, double limit) {
        return new Observation(time, Double.NaN, CensorKind.RIGHT, limit);
    }

    public static Observation censored(double time, double limit, CensorKind kind) {
        return new Observation(time, Double.NaN, kind, limit);
    }

    public boolean isCensored() {
        return censorKind.isCensored();
    }

    /** The measured value, or the detection limit of a censored sample. */
    public double faceValue() {
        return censorKind == CensorKind.NONE ? value : detectionLimit;
    }

    /** {@code true} when the face value is a usable number. */
    public boolean isFinite() {
        return Double.isFinite(faceValue()) && Double.isFinite(time);
    }

    /** Same censoring kind and same reported bound as {@code other}. */
    public boolean sameCensorLevel(Observation other) {
        return isCensored()
                && censorKind == other.censorKind
                && Double.compare(detectionLimit, other.detectionLimit) == 0;
    }

    public Observation withTime(double newTime) {
        return new Observation(newTime, value, censorKind, detectionLimit);
    }

    @Override
    public String toString() {
        return switch (censorKind) {
            case NONE -> value + "@" + time;
            case LEFT -> "<" + detectionLimit + "@" + time;
            case RIGHT -> ">" + detectionLimit + "@" + time;
        };
    }
}
