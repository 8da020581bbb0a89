package com.metricsql.rewrite;

import com.metricsql.exception.RewriteException;
import com.metricsql.query.Query;
import com.metricsql.query.TimeGrain;
import com.metricsql.query.TimeRange;
import com.metricsql.schema.MetricsView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves relative time ranges to absolute bounds.
 *
 * <p>Relative fields are evaluated against the compilation's execution time in
 * the query's time zone (UTC when unset). The primary range is resolved first:
 * <ol>
 *   <li>a compact expression such as {@code 7D} or {@code 3M as of now/M} is
 *       expanded to a window ending at the (optionally rounded) anchor</li>
 *   <li>without bounds, the end defaults to the execution time</li>
 *   <li>the offset shifts both bounds back</li>
 *   <li>the duration fills the missing bound, {@code inf} clears the start</li>
 *   <li>both bounds are truncated to the rounding grain</li>
 * </ol>
 * A comparison range without bounds starts from the primary's resolved bounds.
 * Absolute ranges pass through untouched, so the pass is idempotent.
 */
public class TimeRangeResolution implements QueryRewrite {

    private static final Logger logger = LoggerFactory.getLogger(TimeRangeResolution.class);

    private static final Pattern EXPRESSION = Pattern.compile(
        "^\\s*(\\d+)\\s*([smhDWMQY])(?:\\s+(?i:as\\s+of\\s+now)(?:/([smhDWMQY]))?)?\\s*$");

    @Override
    public Query apply(Query query, RewriteContext context) {
        TimeRange primary = query.timeRange();
        TimeRange comparison = query.comparisonTimeRange();
        boolean primaryRelative = primary != null && primary.isRelative();
        boolean comparisonRelative = comparison != null && comparison.isRelative();
        if (!primaryRelative && !comparisonRelative) {
            return query;
        }

        ZoneId zone = query.timeZone() == null ? ZoneOffset.UTC : ZoneId.of(query.timeZone());
        ZonedDateTime now = context.compileContext().executionTime().atZone(zone);
        MetricsView view = context.view();

        TimeRange resolvedPrimary = primaryRelative
            ? resolve(primary, null, null, now, zone, view)
            : primary;

        TimeRange resolvedComparison = comparison;
        if (comparisonRelative) {
            Instant inheritedStart = resolvedPrimary != null ? resolvedPrimary.start() : null;
            Instant inheritedEnd = resolvedPrimary != null ? resolvedPrimary.end() : now.toInstant();
            resolvedComparison = resolve(comparison, inheritedStart, inheritedEnd, now, zone, view);
        }

        logger.debug("Resolved time range {} -> {}, comparison {} -> {}",
            primary, resolvedPrimary, comparison, resolvedComparison);

        return query.toBuilder()
            .timeRange(resolvedPrimary)
            .comparisonTimeRange(resolvedComparison)
            .build();
    }

    private TimeRange resolve(TimeRange range, Instant defaultStart, Instant defaultEnd,
                              ZonedDateTime now, ZoneId zone, MetricsView view) {
        ZonedDateTime start;
        ZonedDateTime end;
        if (range.hasBounds()) {
            start = at(range.start(), zone);
            end = at(range.end(), zone);
        } else if (defaultStart != null || defaultEnd != null) {
            start = at(defaultStart, zone);
            end = at(defaultEnd, zone);
        } else {
            start = null;
            end = now;
        }

        if (range.expression() != null) {
            Matcher m = EXPRESSION.matcher(range.expression());
            if (!m.matches()) {
                throw new RewriteException("Invalid time range expression '" + range.expression()
                    + "', expected e.g. '7D' or '3M as of now/M'", name());
            }
            long amount = Long.parseLong(m.group(1));
            TimeGrain unit = TimeGrain.fromCode(m.group(2));
            ZonedDateTime anchor = end != null ? end : now;
            if (m.group(3) != null) {
                anchor = TimeGrain.fromCode(m.group(3))
                    .truncate(anchor, view.firstDayOfWeek(), view.firstMonthOfYear());
            }
            end = anchor;
            start = unit.plus(anchor, -amount);
        }

        if (range.isoOffset() != null) {
            IsoDuration offset = parse(range.isoOffset(), "offset");
            if (offset.isInfinite()) {
                throw new RewriteException("Offset cannot be infinite", name());
            }
            start = start != null ? offset.subtractFrom(start) : null;
            end = end != null ? offset.subtractFrom(end) : null;
        }

        if (range.isoDuration() != null) {
            IsoDuration duration = parse(range.isoDuration(), "duration");
            if (duration.isInfinite()) {
                start = null;
            } else if (start == null && end != null) {
                start = duration.subtractFrom(end);
            } else if (start != null && end == null) {
                end = duration.addTo(start);
            }
        }

        TimeGrain round = range.roundToGrain();
        if (round != null) {
            start = start != null ? round.truncate(start, view.firstDayOfWeek(), view.firstMonthOfYear()) : null;
            end = end != null ? round.truncate(end, view.firstDayOfWeek(), view.firstMonthOfYear()) : null;
        }

        Instant resolvedStart = start != null ? start.toInstant() : null;
        Instant resolvedEnd = end != null ? end.toInstant() : null;
        if (resolvedStart != null && resolvedEnd != null && !resolvedStart.isBefore(resolvedEnd)) {
            throw new RewriteException("Time range resolved to an empty window ["
                + resolvedStart + ", " + resolvedEnd + ")", name());
        }
        return TimeRange.absolute(resolvedStart, resolvedEnd);
    }

    private IsoDuration parse(String text, String what) {
        try {
            return IsoDuration.parse(text);
        } catch (IllegalArgumentException e) {
            throw new RewriteException("Invalid " + what + " '" + text + "'", name(), e);
        }
    }

    private static ZonedDateTime at(Instant instant, ZoneId zone) {
        return instant == null ? null : instant.atZone(zone);
    }
}
