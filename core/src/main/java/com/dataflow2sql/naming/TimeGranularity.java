package com.dataflow2sql.naming;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Time truncation levels, ordered from finest to coarsest.
 *
 * <p>Week and year follow ISO-8601: weeks start on Monday and the year starts on
 * the Monday of the week containing January 4th. Month and quarter follow the
 * calendar. {@link #truncate(LocalDate)} is the reference semantics that every
 * dialect's date truncation template must reproduce.
 */
public enum TimeGranularity {
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    /**
     * Returns the lower-case name used as an alias suffix, e.g. {@code week}.
     *
     * @return the granularity name
     */
    public String granularityName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether this granularity is strictly coarser than another.
     *
     * @param other the granularity to compare with
     * @return true if this granularity groups more time than {@code other}
     */
    public boolean isCoarserThan(TimeGranularity other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Returns all granularities strictly coarser than this one, finest first.
     *
     * @return the coarser granularities
     */
    public List<TimeGranularity> coarserGranularities() {
        List<TimeGranularity> result = new ArrayList<>();
        for (TimeGranularity candidate : values()) {
            if (candidate.isCoarserThan(this)) {
                result.add(candidate);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Truncates a date to the start of the period containing it.
     *
     * @param date the date to truncate
     * @return the first day of the enclosing period
     */
    public LocalDate truncate(LocalDate date) {
        switch (this) {
            case DAY:
                return date;
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return date.withDayOfMonth(1);
            case QUARTER:
                int firstMonthOfQuarter = ((date.getMonthValue() - 1) / 3) * 3 + 1;
                return LocalDate.of(date.getYear(), firstMonthOfQuarter, 1);
            case YEAR:
                int isoYear = date.get(IsoFields.WEEK_BASED_YEAR);
                return LocalDate.of(isoYear, 1, 4)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            default:
                throw new IllegalStateException("Unknown granularity: " + this);
        }
    }

    /**
     * Truncates a timestamp to midnight at the start of the enclosing period.
     *
     * @param timestamp the timestamp to truncate
     * @return the truncated timestamp
     */
    public LocalDateTime truncate(LocalDateTime timestamp) {
        return truncate(timestamp.toLocalDate()).atStartOfDay();
    }

    /**
     * Parses a granularity name (case-insensitive).
     *
     * @param value "day", "week", "month", "quarter" or "year"
     * @return the parsed granularity
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static TimeGranularity parse(String value) {
        if (value != null) {
            for (TimeGranularity granularity : values()) {
                if (granularity.granularityName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return granularity;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unknown time granularity: '%s'. Valid values: day, week, month, quarter, year".formatted(value));
    }

    /**
     * Returns whether a name collides with a granularity suffix.
     *
     * @param name the name to check
     * @return true if the name equals some granularity name, ignoring case
     */
    public static boolean isGranularityName(String name) {
        for (TimeGranularity granularity : values()) {
            if (granularity.granularityName().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
