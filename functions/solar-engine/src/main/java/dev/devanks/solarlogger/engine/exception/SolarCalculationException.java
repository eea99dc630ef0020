package dev.devanks.solarlogger.engine.exception;

public class SolarCalculationException extends RuntimeException {
    public SolarCalculationException(String message) {
        super(message);
    }

    public SolarCalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
