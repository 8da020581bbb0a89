package com.metricsql.dialect;

import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.query.TimeGrain;

/**
 * ClickHouse: {@code toStartOf*} truncation functions and {@code LIMIT offset, limit}.
 *
 * <p>One-sided joins are not offered because non-matching rows are filled with
 * column defaults rather than NULL unless {@code join_use_nulls} is set, which
 * would make the missing period indistinguishable from a zero.
 */
public final class ClickHouseDialect extends AbstractDialect {

    public static final String NAME = "clickhouse";

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
        String tzArg = zone == null ? "" : ", " + quoteLiteral(zone);

        switch (grain) {
            case MILLISECOND:
                return "toStartOfMillisecond(" + expr + tzArg + ")";
            case SECOND:
                return "toStartOfSecond(" + expr + tzArg + ")";
            case MINUTE:
                return "toStartOfMinute(" + expr + tzArg + ")";
            case HOUR:
                return "toStartOfHour(" + expr + tzArg + ")";
            case DAY:
                return "toStartOfDay(" + expr + tzArg + ")";
            case WEEK:
                return "toDateTime(toStartOfWeek(" + expr + ", " + weekMode(firstDayOfWeek) + tzArg + ")" + tzArg + ")";
            case MONTH:
                return "toDateTime(toStartOfMonth(" + expr + tzArg + ")" + tzArg + ")";
            case QUARTER:
                return shiftedMonths("toStartOfQuarter", expr, (firstMonthOfYear - 1) % 3, tzArg);
            case YEAR:
                return shiftedMonths("toStartOfYear", expr, firstMonthOfYear - 1, tzArg);
            default:
                throw new UnsupportedFeatureException("time grain " + grain, NAME);
        }
    }

    private static String shiftedMonths(String function, String expr, int months, String tzArg) {
        if (months == 0) {
            return "toDateTime(" + function + "(" + expr + tzArg + ")" + tzArg + ")";
        }
        return "toDateTime(addMonths(" + function + "(subtractMonths(" + expr + ", " + months + ")" + tzArg
            + "), " + months + ")" + tzArg + ")";
    }

    private static int weekMode(int firstDayOfWeek) {
        switch (firstDayOfWeek) {
            case 1:
                return 1;
            case 7:
                return 0;
            default:
                throw new UnsupportedFeatureException(
                    "weeks starting on day " + firstDayOfWeek + " (only Monday and Sunday)", NAME);
        }
    }

    @Override
    public String joinOnExpression(String left, String right) {
        return "isNotDistinctFrom(" + left + ", " + right + ")";
    }

    @Override
    public String safeDivide(String numerator, String denominator) {
        return "if(" + denominator + " = 0, NULL, " + numerator + " / " + denominator + ")";
    }

    @Override
    public String firstValueAggregate(String expr) {
        return "any(" + expr + ")";
    }

    @Override
    public String limitClause(Long limit, Long offset) {
        if (limit != null && offset != null && offset > 0) {
            return "LIMIT " + offset + ", " + limit;
        }
        return super.limitClause(limit, offset);
    }

    @Override
    public boolean supportsApproximateComparison() {
        return false;
    }

    @Override
    public boolean requiresGroupingForJoins() {
        return false;
    }
}
