package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL) // sunrise and sunset are absent on polar days and nights
public class GeometryResult {
    double latitude;
    double longitude;
    CivilInstant instant;
    double tzOffsetHours;
    double julianDay;
    double radianceVector;
    double rightAscensionDeg;
    double declinationDeg;
    double equationOfTimeMinutes;
    ClockTime solarNoon;
    ClockTime sunriseTime;
    ClockTime sunsetTime;
    double sunlightDurationMinutes;
    DaylightCondition daylight;
    double hourAngleDeg;
    double solarZenithDeg;
    // Refraction corrected
    double solarElevationDeg;
    double solarAzimuthDeg;

    public boolean isSunUp() {
        return solarElevationDeg > 0;
    }
}
