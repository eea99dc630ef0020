package dev.devanks.solarlogger.engine.model;

import lombok.Value;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Spacing of a time grid, either whole hours or whole minutes.
 */
@Value
public class SamplingStep {
    int amount;
    ChronoUnit unit;

    public SamplingStep(int amount, ChronoUnit unit) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Sampling step amount must be positive, got " + amount);
        }
        if (unit != ChronoUnit.HOURS && unit != ChronoUnit.MINUTES) {
            throw new IllegalArgumentException("Sampling step unit must be HOURS or MINUTES, got " + (unit == null ? null : unit.name()));
        }
        this.amount = amount;
        this.unit = unit;
    }

    public static SamplingStep hours(int amount) {
        return new SamplingStep(amount, ChronoUnit.HOURS);
    }

    public static SamplingStep minutes(int amount) {
        return new SamplingStep(amount, ChronoUnit.MINUTES);
    }

    public Duration toDuration() {
        return Duration.of(amount, unit);
    }
}
