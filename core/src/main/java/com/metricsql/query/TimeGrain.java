package com.metricsql.query;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Time truncation granularity for time dimensions and time-range rounding.
 *
 * <p>Week, quarter and year truncation honor the metrics view's first day of
 * week (1 = Monday ... 7 = Sunday) and first month of year (1 = January ...).
 */
public enum TimeGrain {
    MILLISECOND("ms", ChronoUnit.MILLIS),
    SECOND("s", ChronoUnit.SECONDS),
    MINUTE("m", ChronoUnit.MINUTES),
    HOUR("h", ChronoUnit.HOURS),
    DAY("D", ChronoUnit.DAYS),
    WEEK("W", ChronoUnit.WEEKS),
    MONTH("M", ChronoUnit.MONTHS),
    QUARTER("Q", null),
    YEAR("Y", ChronoUnit.YEARS);

    private final String code;
    private final ChronoUnit unit;

    TimeGrain(String code, ChronoUnit unit) {
        this.code = code;
        this.unit = unit;
    }

    /**
     * Returns the short unit code used in compact time expressions ({@code 7D}, {@code 3M}).
     *
     * @return the unit code
     */
    public String code() {
        return code;
    }

    /**
     * Truncates a zoned timestamp to the start of its grain, calendar-aware.
     *
     * @param time the timestamp to truncate
     * @param firstDayOfWeek first day of week, 1 (Monday) to 7 (Sunday)
     * @param firstMonthOfYear first month of year, 1 to 12
     * @return the truncated timestamp, in the same zone
     */
    public ZonedDateTime truncate(ZonedDateTime time, int firstDayOfWeek, int firstMonthOfYear) {
        switch (this) {
            case MILLISECOND:
            case SECOND:
            case MINUTE:
            case HOUR:
            case DAY:
                return time.truncatedTo(unit);
            case WEEK:
                return time.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.of(firstDayOfWeek)));
            case MONTH:
                return time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case QUARTER: {
                ZonedDateTime month = time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
                int sinceYearStart = Math.floorMod(month.getMonthValue() - firstMonthOfYear, 12);
                return month.minusMonths(sinceYearStart % 3);
            }
            case YEAR: {
                ZonedDateTime month = time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
                return month.minusMonths(Math.floorMod(month.getMonthValue() - firstMonthOfYear, 12));
            }
            default:
                throw new IllegalStateException("Unhandled grain: " + this);
        }
    }

    /**
     * Adds {@code amount} grains to a timestamp using calendar arithmetic.
     *
     * @param time the starting timestamp
     * @param amount number of grains, may be negative
     * @return the shifted timestamp
     */
    public ZonedDateTime plus(ZonedDateTime time, long amount) {
        if (this == QUARTER) {
            return time.plusMonths(3 * amount);
        }
        return time.plus(amount, unit);
    }

    /**
     * Looks up a grain by its unit code. Codes are case-sensitive because
     * {@code m} (minute) and {@code M} (month) differ.
     *
     * @param code the unit code
     * @return the grain
     * @throws IllegalArgumentException if the code is unknown
     */
    public static TimeGrain fromCode(String code) {
        for (TimeGrain grain : values()) {
            if (grain.code.equals(code)) {
                return grain;
            }
        }
        throw new IllegalArgumentException("Unknown time grain unit: '" + code + "'");
    }
}
