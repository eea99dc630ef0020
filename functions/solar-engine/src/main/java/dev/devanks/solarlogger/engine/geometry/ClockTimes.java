package dev.devanks.solarlogger.engine.geometry;

import dev.devanks.solarlogger.engine.exception.InvalidClockTimeException;
import dev.devanks.solarlogger.engine.model.ClockTime;

import java.time.DateTimeException;
import java.time.LocalTime;

final class ClockTimes {

    private ClockTimes() {
    }

    /**
     * Converts a fraction of a local day into a wall clock time, truncated to whole seconds.
     * Fractions outside [0, 1) roll into the neighbouring day and are reported through the day offset.
     */
    static ClockTime fromDayFraction(double t) {
        if (!Double.isFinite(t)) {
            throw new InvalidClockTimeException(t, null);
        }
        long hours = (long) Math.floor(t * 24.0);
        long minutes = (long) Math.floor(t * 1440.0 - hours * 60.0);
        long seconds = (long) Math.floor(t * 86400.0 - hours * 3600.0 - minutes * 60.0);
        try {
            var time = LocalTime.of(Math.toIntExact(Math.floorMod(hours, 24L)), Math.toIntExact(minutes), Math.toIntExact(seconds));
            return new ClockTime(time, Math.toIntExact(Math.floorDiv(hours, 24L)));
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidClockTimeException(t, e);
        }
    }
}
