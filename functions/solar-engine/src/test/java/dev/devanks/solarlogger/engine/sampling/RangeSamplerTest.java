package dev.devanks.solarlogger.engine.sampling;

import dev.devanks.solarlogger.engine.model.SamplingStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RangeSampler Unit Tests")
class RangeSamplerTest {

    @Test
    @DisplayName("dateRange: includes both ends")
    void dateRange_inclusive() {
        var dates = RangeSampler.dateRange(LocalDate.of(2024, 2, 27), LocalDate.of(2024, 3, 1));

        assertThat(dates).containsExactly(
                LocalDate.of(2024, 2, 27),
                LocalDate.of(2024, 2, 28),
                LocalDate.of(2024, 2, 29),
                LocalDate.of(2024, 3, 1));
    }

    @Test
    @DisplayName("dateRange: two consecutive days yield exactly those dates")
    void dateRange_twoDays() {
        var dates = RangeSampler.dateRange(LocalDate.of(2024, 9, 10), LocalDate.of(2024, 9, 11));

        assertThat(dates).containsExactly(LocalDate.of(2024, 9, 10), LocalDate.of(2024, 9, 11));
    }

    @Test
    @DisplayName("dateRange: a single day yields one element")
    void dateRange_singleDay() {
        var day = LocalDate.of(2024, 9, 10);

        assertThat(RangeSampler.dateRange(day, day)).containsExactly(day);
    }

    @Test
    @DisplayName("dateRange: end before start is rejected")
    void dateRange_reversed() {
        assertThatThrownBy(() -> RangeSampler.dateRange(LocalDate.of(2024, 9, 10), LocalDate.of(2024, 9, 9)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("before its start");
    }

    @Test
    @DisplayName("timeRange: a whole day at ten minutes includes both ends")
    void timeRange_tenMinutes() {
        var times = RangeSampler.timeRange(LocalTime.of(5, 0), LocalTime.of(19, 0), SamplingStep.minutes(10));

        assertThat(times).hasSize(85);
        assertThat(times.get(0)).isEqualTo(LocalTime.of(5, 0));
        assertThat(times.get(1)).isEqualTo(LocalTime.of(5, 10));
        assertThat(times.get(84)).isEqualTo(LocalTime.of(19, 0));
    }

    @Test
    @DisplayName("timeRange: two hour steps over a day end exactly at the last time")
    void timeRange_twoHours() {
        var times = RangeSampler.timeRange(LocalTime.of(5, 0), LocalTime.of(19, 0), SamplingStep.hours(2));

        assertThat(times).hasSize(8);
        assertThat(times.get(0)).isEqualTo(LocalTime.of(5, 0));
        assertThat(times.get(7)).isEqualTo(LocalTime.of(19, 0));
    }

    @Test
    @DisplayName("timeRange: a full day to 23:59:59 at ten minutes stops at 23:50")
    void timeRange_fullDayTruncated() {
        var times = RangeSampler.timeRange(LocalTime.MIDNIGHT, LocalTime.of(23, 59, 59), SamplingStep.minutes(10));

        assertThat(times).hasSize(144);
        assertThat(times.get(0)).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(times.get(143)).isEqualTo(LocalTime.of(23, 50));
    }

    @Test
    @DisplayName("timeRange: a span that is not a whole number of steps stops short of the end")
    void timeRange_truncated() {
        var times = RangeSampler.timeRange(LocalTime.of(5, 30), LocalTime.of(7, 0), SamplingStep.hours(1));

        assertThat(times).containsExactly(LocalTime.of(5, 30), LocalTime.of(6, 30));
    }

    @Test
    @DisplayName("timeRange: equal ends yield the start only")
    void timeRange_emptySpan() {
        var noon = LocalTime.NOON;

        assertThat(RangeSampler.timeRange(noon, noon, SamplingStep.minutes(15))).containsExactly(noon);
    }

    @Test
    @DisplayName("timeRange: end before start is rejected")
    void timeRange_reversed() {
        assertThatThrownBy(() -> RangeSampler.timeRange(LocalTime.of(19, 0), LocalTime.of(5, 0), SamplingStep.hours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("SamplingStep: only positive hour or minute steps are allowed")
    void samplingStep_validation() {
        assertThat(SamplingStep.hours(2).toDuration().toMinutes()).isEqualTo(120);

        assertThatThrownBy(() -> SamplingStep.minutes(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SamplingStep.hours(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SamplingStep(1, ChronoUnit.DAYS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DAYS");
    }
}
