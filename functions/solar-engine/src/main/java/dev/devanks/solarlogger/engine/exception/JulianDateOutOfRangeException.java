package dev.devanks.solarlogger.engine.exception;

import lombok.Getter;

/**
 * Thrown when an instant lies outside the years the Julian Day approximation supports.
 */
@Getter
public class JulianDateOutOfRangeException extends SolarCalculationException {

    private final int year;

    public JulianDateOutOfRangeException(int year, int minYear, int maxYear) {
        super(String.format("Year %d is outside the supported Julian Day range [%d, %d]", year, minYear, maxYear));
        this.year = year;
    }
}
