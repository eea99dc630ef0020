package dev.devanks.solarlogger.engine.sampling;

import dev.devanks.solarlogger.engine.model.SamplingStep;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * Date and time grids for sampling.
 */
public final class RangeSampler {

    private RangeSampler() {
    }

    /**
     * @return Every date from {@code from} to {@code to}, both included.
     * @throws IllegalArgumentException if {@code to} is before {@code from}.
     */
    public static List<LocalDate> dateRange(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Date range end " + to + " is before its start " + from);
        }
        long days = ChronoUnit.DAYS.between(from, to);
        return LongStream.rangeClosed(0, days)
                .mapToObj(from::plusDays)
                .toList();
    }

    /**
     * Times from {@code from} spaced by {@code step}. The number of steps is the span divided by the
     * step, truncated, so the last element is {@code to} only when the span is a whole number of steps.
     *
     * @throws IllegalArgumentException if {@code to} is before {@code from}.
     */
    public static List<LocalTime> timeRange(LocalTime from, LocalTime to, SamplingStep step) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Time range end " + to + " is before its start " + from);
        }
        Duration stepDuration = step.toDuration();
        long steps = Duration.between(from, to).getSeconds() / stepDuration.getSeconds();
        return IntStream.rangeClosed(0, Math.toIntExact(steps))
                .mapToObj(i -> from.plus(stepDuration.multipliedBy(i)))
                .toList();
    }
}
