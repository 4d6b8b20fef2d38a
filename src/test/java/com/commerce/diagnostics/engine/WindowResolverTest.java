package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.ComparisonWindows;
import com.commerce.diagnostics.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowResolverTest {

    private static final Instant REF = Instant.parse("2026-01-10T14:00:00Z");

    private final WindowResolver resolver = new WindowResolver();

    @Test
    void resolve_explicitPair_returnedAsIs() {
        TimeWindow window = resolver.resolve("2026-01-10T14:00:00Z|2026-01-10T14:45:00Z", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-10T14:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(Instant.parse("2026-01-10T14:45:00Z"));
        assertThat(window.isSameHourAverage()).isFalse();
    }

    @Test
    void resolve_prevDaySameHour_oneHourOneDayBefore() {
        TimeWindow window = resolver.resolve("prev_day_same_hour", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-09T14:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(Instant.parse("2026-01-09T15:00:00Z"));
    }

    @Test
    void resolve_yesterdayAlias_matchesPrevDay() {
        assertThat(resolver.resolve("yesterday_same_hour", REF))
                .isEqualTo(resolver.resolve("prev_day_same_hour", REF));
    }

    @Test
    void resolve_prevWeekSameHour_sevenDaysBefore() {
        TimeWindow window = resolver.resolve("same_day_last_week", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-03T14:00:00Z"));
        assertThat(window.getDuration()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void resolve_prev24Hours_rollingDayEndingAtReference() {
        TimeWindow window = resolver.resolve("prev_24_hours", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-09T14:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(REF);
    }

    @Test
    void resolve_avgPrevDaysSameHour_spansDaysAndCarriesHour() {
        TimeWindow window = resolver.resolve("avg_prev_3_days_same_hour", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-07T14:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(REF);
        assertThat(window.getSameHourDays()).isEqualTo(3);
        assertThat(window.getHourOfDay()).isEqualTo(14);
        assertThat(window.getSampleCount()).isEqualTo(3);
    }

    @Test
    void resolve_avgPrevSingularDay_accepted() {
        TimeWindow window = resolver.resolve("avg_prev_1_day_same_hour", REF);

        assertThat(window.getSameHourDays()).isEqualTo(1);
    }

    @Test
    void resolve_bareInstant_oneHourWindow() {
        TimeWindow window = resolver.resolve("2026-01-10T09:00:00Z", REF);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-10T09:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(Instant.parse("2026-01-10T10:00:00Z"));
    }

    @Test
    void resolve_unknownToken_throws() {
        assertThatThrownBy(() -> resolver.resolve("last_fortnight", REF))
                .isInstanceOf(UnknownWindowException.class)
                .hasMessageContaining("last_fortnight");
    }

    @Test
    void resolve_malformedPair_throws() {
        assertThatThrownBy(() -> resolver.resolve("2026-01-10T14:00:00Z|not-a-date", REF))
                .isInstanceOf(UnknownWindowException.class);
    }

    @Test
    void resolveComparison_baselineAnchoredOnCurrentStart() {
        Alert alert = Alert.builder()
                .currentWindow("2026-01-10T14:00:00Z|2026-01-10T15:00:00Z")
                .baselineWindow("prev_day_same_hour")
                .build();

        ComparisonWindows windows = resolver.resolveComparison(alert);

        assertThat(windows.getCurrent().getStart()).isEqualTo(Instant.parse("2026-01-10T14:00:00Z"));
        assertThat(windows.getBaseline().getStart()).isEqualTo(Instant.parse("2026-01-09T14:00:00Z"));
    }

    @Test
    void resolveComparison_missingBaseline_defaultsToThreeDayAverage() {
        Alert alert = Alert.builder().currentWindow("2026-01-10T14:00:00Z|2026-01-10T15:00:00Z").build();

        ComparisonWindows windows = resolver.resolveComparison(alert);

        assertThat(windows.getBaseline().getSameHourDays()).isEqualTo(3);
        assertThat(windows.getBaseline().getHourOfDay()).isEqualTo(14);
    }

    @Test
    void resolveCurrent_timestampOnly_usesOneHourFromTimestamp() {
        Alert alert = Alert.builder().timestamp("2026-01-10T08:00:00Z").build();

        TimeWindow window = resolver.resolveCurrent(alert);

        assertThat(window.getStart()).isEqualTo(Instant.parse("2026-01-10T08:00:00Z"));
        assertThat(window.getEnd()).isEqualTo(Instant.parse("2026-01-10T09:00:00Z"));
    }
}
