package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a symbolic window token and a reference instant to a concrete {@code [start, end)} interval.
 *
 * Supported tokens:
 * <ul>
 *   <li>{@code start|end}: explicit ISO pair, returned as-is</li>
 *   <li>bare ISO instant: one hour starting at that instant</li>
 *   <li>{@code prev_day_same_hour}, {@code yesterday_same_hour}: one hour, 1 day before reference</li>
 *   <li>{@code prev_week_same_hour}, {@code same_day_last_week}: one hour, 7 days before reference</li>
 *   <li>{@code prev_24_hours}: rolling 24 hours ending at reference</li>
 *   <li>{@code avg_prev_N_days_same_hour}: reference minus N days up to reference, averaged per
 *       day over the reference's hour of day</li>
 * </ul>
 * All times are UTC.
 */
@Component
public class WindowResolver {

    private static final Pattern AVG_PREV_DAYS = Pattern.compile("^avg_prev_(\\d+)_days?_same_hour$");
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    public TimeWindow resolve(String token, Instant reference) {
        if (token == null || token.isBlank()) {
            throw new UnknownWindowException(String.valueOf(token));
        }
        String trimmed = token.trim();
        Instant ref = reference != null ? reference : Instant.now();

        switch (trimmed) {
            case "prev_day_same_hour":
            case "yesterday_same_hour":
                return hourAt(ref.minus(Duration.ofDays(1)));
            case "prev_week_same_hour":
            case "same_day_last_week":
                return hourAt(ref.minus(Duration.ofDays(7)));
            case "prev_24_hours":
                return TimeWindow.of(ref.minus(Duration.ofHours(24)), ref);
            default:
                break;
        }

        Matcher avg = AVG_PREV_DAYS.matcher(trimmed);
        if (avg.matches()) {
            int days = Integer.parseInt(avg.group(1));
            if (days < 1) {
                throw new UnknownWindowException(token);
            }
            return TimeWindow.builder()
                    .start(ref.minus(Duration.ofDays(days)))
                    .end(ref)
                    .sameHourDays(days)
                    .hourOfDay(ref.atOffset(ZoneOffset.UTC).getHour())
                    .build();
        }

        if (trimmed.contains("|")) {
            String[] parts = trimmed.split("\\|", -1);
            Instant start = parseInstant(parts[0]);
            Instant end = parts.length == 2 ? parseInstant(parts[1]) : null;
            if (start == null || end == null) {
                throw new UnknownWindowException(token);
            }
            return TimeWindow.of(start, end);
        }

        Instant instant = parseInstant(trimmed);
        if (instant != null) {
            return hourAt(instant);
        }

        throw new UnknownWindowException(token);
    }

    /**
     * Resolve the current window of an alert (against now) and its baseline
     * (against the current window's start).
     */
    public ComparisonWindows resolveComparison(Alert alert) {
        TimeWindow current = resolveCurrent(alert);
        TimeWindow baseline = resolve(alert.getBaselineWindowOrDefault(), current.getStart());
        return ComparisonWindows.builder()
                .current(current)
                .baseline(baseline)
                .build();
    }

    public TimeWindow resolveCurrent(Alert alert) {
        Instant now = Instant.now();
        String token = alert.getCurrentWindow();
        if (token == null || token.isBlank()) {
            token = alert.getTimestamp();
        }
        if (token == null || token.isBlank()) {
            token = now.toString();
        }
        return resolve(token, now);
    }

    private TimeWindow hourAt(Instant start) {
        return TimeWindow.of(start, start.plus(ONE_HOUR));
    }

    private Instant parseInstant(String text) {
        String value = text.trim();
        if (value.isEmpty()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to the offset and local forms
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
