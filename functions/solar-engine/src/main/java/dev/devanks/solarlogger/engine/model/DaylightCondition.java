package dev.devanks.solarlogger.engine.model;

public enum DaylightCondition {
    NORMAL,
    // Sun stays above the horizon all day
    POLAR_DAY,
    // Sun stays below the horizon all day
    POLAR_NIGHT
}
