package com.metricsql.query;

import java.time.Instant;

/**
 * A time window over the metrics view's time dimension.
 *
 * <p>Either absolute ({@code [start, end)}, either bound optional) or relative.
 * Relative fields are resolved against an execution timestamp by the time-range
 * resolution pass, which clears them; a range with no bounds and no relative
 * fields means "all time".
 *
 * <p>Relative fields:
 * <ul>
 *   <li>{@code isoDuration} - window length, e.g. {@code P1D}, {@code P3M}, {@code PT6H}, or {@code inf}</li>
 *   <li>{@code isoOffset} - shifts both bounds back, e.g. {@code P1W}</li>
 *   <li>{@code roundToGrain} - truncates both bounds to a grain</li>
 *   <li>{@code expression} - compact form such as {@code 7D} or {@code 3M as of now/M}</li>
 * </ul>
 */
public record TimeRange(Instant start, Instant end, String isoDuration, String isoOffset,
                        TimeGrain roundToGrain, String expression) {

    public static TimeRange absolute(Instant start, Instant end) {
        return new TimeRange(start, end, null, null, null, null);
    }

    public static TimeRange lastDuration(String isoDuration) {
        return new TimeRange(null, null, isoDuration, null, null, null);
    }

    public static TimeRange ofExpression(String expression) {
        return new TimeRange(null, null, null, null, null, expression);
    }

    public static TimeRange offset(String isoOffset) {
        return new TimeRange(null, null, null, isoOffset, null, null);
    }

    public TimeRange withRoundToGrain(TimeGrain grain) {
        return new TimeRange(start, end, isoDuration, isoOffset, grain, expression);
    }

    /**
     * Returns whether any relative field still needs resolving.
     *
     * @return true if a relative field is set
     */
    public boolean isRelative() {
        return isoDuration != null || isoOffset != null || roundToGrain != null || expression != null;
    }

    public boolean hasBounds() {
        return start != null || end != null;
    }
}
