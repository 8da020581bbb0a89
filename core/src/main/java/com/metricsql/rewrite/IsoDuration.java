package com.metricsql.rewrite;

import java.time.Duration;
import java.time.Period;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * ISO-8601 duration with calendar-aware date part ({@code P1M} is a month, not
 * 30 days) and exact time part, or the special value {@code inf}.
 */
final class IsoDuration {

    static final String INFINITE = "inf";

    private final Period period;
    private final Duration duration;
    private final boolean infinite;

    private IsoDuration(Period period, Duration duration, boolean infinite) {
        this.period = period;
        this.duration = duration;
        this.infinite = infinite;
    }

    /**
     * Parses {@code P1D}, {@code PT6H}, {@code P1DT12H}, {@code P2W} or {@code inf}.
     *
     * @param text the duration text
     * @return the duration
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    static IsoDuration parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String value = text.trim();
        if (value.equalsIgnoreCase(INFINITE)) {
            return new IsoDuration(Period.ZERO, Duration.ZERO, true);
        }
        String upper = value.toUpperCase(Locale.ROOT);
        if (!upper.startsWith("P") || upper.length() < 3 || upper.endsWith("T")) {
            throw new IllegalArgumentException("Invalid ISO-8601 duration: '" + text + "'");
        }
        int t = upper.indexOf('T');
        String datePart = t < 0 ? upper : upper.substring(0, t);
        String timePart = t < 0 ? null : "PT" + upper.substring(t + 1);
        try {
            Period p = datePart.length() > 1 ? Period.parse(datePart) : Period.ZERO;
            Duration d = timePart != null ? Duration.parse(timePart) : Duration.ZERO;
            return new IsoDuration(p, d, false);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 duration: '" + text + "'", e);
        }
    }

    boolean isInfinite() {
        return infinite;
    }

    ZonedDateTime subtractFrom(ZonedDateTime time) {
        return time.minus(period).minus(duration);
    }

    ZonedDateTime addTo(ZonedDateTime time) {
        return time.plus(period).plus(duration);
    }

    @Override
    public String toString() {
        return infinite ? INFINITE : period + "/" + duration;
    }
}
