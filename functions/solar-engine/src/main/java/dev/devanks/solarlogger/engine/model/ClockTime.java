package dev.devanks.solarlogger.engine.model;

import lombok.Value;

import java.time.LocalTime;

/**
 * A local wall clock time derived from a day fraction. {@code dayOffset} is 1 when the time
 * falls on the following day and -1 when it falls on the previous one.
 */
@Value
public class ClockTime {
    LocalTime time;
    int dayOffset;

    public static ClockTime sameDay(LocalTime time) {
        return new ClockTime(time, 0);
    }

    @Override
    public String toString() {
        return dayOffset == 0 ? time.toString() : String.format("%s%+dd", time, dayOffset);
    }
}
