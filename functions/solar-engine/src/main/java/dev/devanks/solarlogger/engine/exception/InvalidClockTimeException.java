package dev.devanks.solarlogger.engine.exception;

import lombok.Getter;

@Getter
public class InvalidClockTimeException extends SolarCalculationException {

    private final double dayFraction;

    public InvalidClockTimeException(double dayFraction, Throwable cause) {
        super("Day fraction " + dayFraction + " does not map to a valid clock time", cause);
        this.dayFraction = dayFraction;
    }
}
