package com.metricsql.dialect;

import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.query.TimeGrain;

/**
 * Apache Druid SQL.
 *
 * <p>Druid has no ILIKE, floors time with {@code TIME_FLOOR} periods, and
 * requires grouping with aggregated measures around joins. Its broker caps
 * subquery results, so a default row cap applies.
 */
public final class DruidDialect extends AbstractDialect {

    public static final String NAME = "druid";

    static final long DEFAULT_ROW_CAP = 100_000L;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsILike() {
        return false;
    }

    @Override
    public String dateTrunc(String expr, TimeGrain grain, String timeZone,
                            int firstDayOfWeek, int firstMonthOfYear) {
        String zone = quoteLiteral(timeZone == null || timeZone.isEmpty() ? "UTC" : timeZone);
        String period = period(grain);

        if (grain == TimeGrain.WEEK && firstDayOfWeek != 1) {
            return shifted(expr, period, "P1D", firstDayOfWeek - 1, zone);
        }
        if (grain == TimeGrain.YEAR && firstMonthOfYear != 1) {
            return shifted(expr, period, "P1M", firstMonthOfYear - 1, zone);
        }
        if (grain == TimeGrain.QUARTER && (firstMonthOfYear - 1) % 3 != 0) {
            return shifted(expr, period, "P1M", (firstMonthOfYear - 1) % 3, zone);
        }
        return "TIME_FLOOR(" + expr + ", '" + period + "', NULL, " + zone + ")";
    }

    private static String shifted(String expr, String period, String step, int amount, String zone) {
        return "TIME_SHIFT(TIME_FLOOR(TIME_SHIFT(" + expr + ", '" + step + "', -" + amount + ", " + zone + "), '"
            + period + "', NULL, " + zone + "), '" + step + "', " + amount + ", " + zone + ")";
    }

    private static String period(TimeGrain grain) {
        switch (grain) {
            case SECOND:
                return "PT1S";
            case MINUTE:
                return "PT1M";
            case HOUR:
                return "PT1H";
            case DAY:
                return "P1D";
            case WEEK:
                return "P1W";
            case MONTH:
                return "P1M";
            case QUARTER:
                return "P3M";
            case YEAR:
                return "P1Y";
            default:
                throw new UnsupportedFeatureException("time grain " + grain, NAME);
        }
    }

    @Override
    public String joinOnExpression(String left, String right) {
        // Druid only plans equi-joins, so null dimension values do not match
        return left + " = " + right;
    }

    @Override
    public String safeDivide(String numerator, String denominator) {
        return "SAFE_DIVIDE(" + numerator + ", " + denominator + ")";
    }

    @Override
    public boolean supportsApproximateComparison() {
        return true;
    }

    @Override
    public boolean requiresGroupingForJoins() {
        return true;
    }

    @Override
    public boolean groupByOrdinals() {
        return true;
    }

    @Override
    public long defaultRowCap() {
        return DEFAULT_ROW_CAP;
    }
}
