/* (C)2026 */
package com.ammann.trend.enumeration;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;

/**
 * Cyclical key used to partition a series into seasons.
 *
 * <p>Calendar keys interpret the time axis as seconds since the epoch and are evaluated in
 * UTC. {@link #PERIOD} works on any numeric axis: the key is
 * {@code floor(t - origin) mod period}.
 */
public enum SeasonType {
    MONTH,
    DAY_OF_WEEK,
    QUARTER,
    HOUR,
    MINUTE,
    DAY_OF_YEAR,
    WEEK_OF_YEAR,
    PERIOD;

    /**
     * Computes the season key of a time value.
     *
     * @param time   time value (epoch seconds for calendar keys)
     * @param origin smallest time in the series, used by {@link #PERIOD}
     * @param period cycle length, used by {@link #PERIOD}
     * @return season key
     */
    public int seasonOf(double time, double origin, int period) {
        if (this == PERIOD) {
            if (period < 1) {
                throw new IllegalArgumentException("period must be >= 1 for PERIOD seasons, got " + period);
            }
            long offset = (long) Math.floor(time - origin);
            return (int) Math.floorMod(offset, (long) period);
        }

        ZonedDateTime dateTime = Instant.ofEpochSecond((long) Math.floor(time)).atZone(ZoneOffset.UTC);
        return switch (this) {
            case MONTH -> dateTime.getMonthValue();
            case DAY_OF_WEEK -> dateTime.getDayOfWeek().getValue();
            case QUARTER -> dateTime.get(IsoFields.QUARTER_OF_YEAR);
            case HOUR -> dateTime.getHour();
            case MINUTE -> dateTime.getMinute();
            case DAY_OF_YEAR -> dateTime.getDayOfYear();
            case WEEK_OF_YEAR -> dateTime.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            default -> throw new IllegalStateException("Unhandled season type " + this);
        };
    }

    public static SeasonType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("SeasonType value cannot be null");
        }
        for (SeasonType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Invalid season type: " + value);
    }
}
