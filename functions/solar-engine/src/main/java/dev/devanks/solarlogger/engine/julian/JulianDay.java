package dev.devanks.solarlogger.engine.julian;

import dev.devanks.solarlogger.engine.exception.JulianDateOutOfRangeException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Julian Day approximation from Michalsky (1988), "The Astronomical Almanac's algorithm for
 * approximate solar position (1950-2050)". The day count is anchored on 1949-12-31 and is only
 * accurate for UTC years 1950 through 2050.
 */
public final class JulianDay {

    public static final int MIN_YEAR = 1950;
    public static final int MAX_YEAR = 2050;

    private static final int BASE_YEAR = 1949;
    private static final double BASE_JULIAN_DAY = 2432916.5;

    private JulianDay() {
    }

    /**
     * @param instant The instant to convert.
     * @return The Julian Day of the instant.
     * @throws JulianDateOutOfRangeException if the UTC year is outside [1950, 2050].
     */
    public static double of(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        int delta = utc.getYear() - BASE_YEAR;
        if (delta < 1 || delta > MAX_YEAR - BASE_YEAR) {
            throw new JulianDateOutOfRangeException(utc.getYear(), MIN_YEAR, MAX_YEAR);
        }
        int leapDays = delta / 4;
        int dayOfYear = utc.getDayOfYear();
        double partialDay = (utc.getHour() + utc.getMinute() / 60.0 + utc.getSecond() / 3600.0) / 24.0;
        return BASE_JULIAN_DAY + delta * 365 + leapDays + dayOfYear + partialDay;
    }

    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - 2451545.0) / 36525.0;
    }
}
