package com.commerce.diagnostics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A concrete half-open interval {@code [start, end)}.
 *
 * When {@code sameHourDays > 0} the window spans that many days and is meant to be read
 * as the average of the hour starting at {@code hourOfDayStart} over each of those days:
 * the query layer restricts rows to that hour and volume counts are divided by the day count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeWindow {

    private Instant start;
    private Instant end;

    @Builder.Default
    private int sameHourDays = 0;

    private Integer hourOfDay;

    public static TimeWindow of(Instant start, Instant end) {
        return TimeWindow.builder().start(start).end(end).build();
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public boolean isSameHourAverage() {
        return sameHourDays > 0 && hourOfDay != null;
    }

    /**
     * Divisor that turns an aggregated volume over this window into a per-sample value.
     */
    public int getSampleCount() {
        return isSameHourAverage() ? sameHourDays : 1;
    }
}
