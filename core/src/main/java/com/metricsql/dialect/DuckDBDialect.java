package com.metricsql.dialect;

import com.metricsql.query.TimeGrain;

import java.util.Locale;

/**
 * DuckDB: native ILIKE, {@code date_trunc} with ICU time zone conversion.
 *
 * <p>Time columns hold UTC {@code TIMESTAMP}s. Zone conversions go through
 * {@code timezone('UTC', ...)} on both sides, so truncation does not depend
 * on the session's TimeZone setting and yields a UTC {@code TIMESTAMP}.
 */
public final class DuckDBDialect extends AbstractDialect {

    public static final String NAME = "duckdb";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsILike() {
        return true;
    }

    @Override
    public String dateTrunc(String expr, TimeGrain grain, String timeZone,
                            int firstDayOfWeek, int firstMonthOfYear) {
        String zone = effectiveZone(timeZone);
        String local = zone == null
            ? expr + "::TIMESTAMP"
            : "timezone(" + quoteLiteral(zone) + ", timezone('UTC', " + expr + "::TIMESTAMP))";

        // date_trunc only knows Monday weeks and January years; shift around it
        String shiftUnit = null;
        int shift = 0;
        if (grain == TimeGrain.WEEK && firstDayOfWeek != 1) {
            shiftUnit = "DAY";
            shift = firstDayOfWeek - 1;
        } else if (grain == TimeGrain.YEAR && firstMonthOfYear != 1) {
            shiftUnit = "MONTH";
            shift = firstMonthOfYear - 1;
        } else if (grain == TimeGrain.QUARTER && (firstMonthOfYear - 1) % 3 != 0) {
            shiftUnit = "MONTH";
            shift = (firstMonthOfYear - 1) % 3;
        }

        String specifier = quoteLiteral(grain.name().toLowerCase(Locale.ROOT));
        String truncated;
        if (shiftUnit == null) {
            truncated = "date_trunc(" + specifier + ", " + local + ")";
        } else {
            String interval = "INTERVAL " + shift + " " + shiftUnit;
            truncated = "(date_trunc(" + specifier + ", " + local + " - " + interval + ") + " + interval + ")";
        }

        if (zone == null) {
            return truncated + "::TIMESTAMP";
        }
        return "timezone('UTC', timezone(" + quoteLiteral(zone) + ", " + truncated + "))";
    }

    @Override
    public boolean supportsApproximateComparison() {
        return true;
    }

    @Override
    public boolean requiresGroupingForJoins() {
        return false;
    }
}
