package dev.devanks.solarlogger.engine.geometry;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarlogger.engine.config.SolarProperties;
import dev.devanks.solarlogger.engine.exception.InvalidClockTimeException;
import dev.devanks.solarlogger.engine.julian.JulianDay;
import dev.devanks.solarlogger.engine.model.ClockTime;
import dev.devanks.solarlogger.engine.model.DaylightCondition;
import dev.devanks.solarlogger.engine.model.GeometryResult;
import dev.devanks.solarlogger.engine.model.SunObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

import static java.lang.Math.acos;
import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.pow;
import static java.lang.Math.sin;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Sun position after the NOAA solar calculation spreadsheet
 * (https://gml.noaa.gov/grad/solcalc/calcdetails.html), with the Julian Day taken from {@link JulianDay}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SolarGeometryCalculator {

    // Zenith of the sun's centre at sunrise: 90° plus disk radius plus standard horizon refraction
    private static final double SUNRISE_ZENITH = 90.833;
    private static final double NO_ZENITH_CLAMP = 180.0;

    private final SolarProperties properties;

    /**
     * Computes the sun's geometry for a position and instant.
     *
     * @param observation The position and the instant, read on the wall clock of its zone.
     * @return The full geometry, elevation corrected for refraction.
     */
    public GeometryResult calculate(SunObservation observation) {
        return calculate(observation, NO_ZENITH_CLAMP);
    }

    /**
     * Same as {@link #calculate(SunObservation)}, but the zenith angle used for the elevation is capped at
     * {@code solar.geometry.max-zenith-degrees} so refraction stays bounded when the sun is far below
     * the horizon. Used when sampling series for plots.
     */
    public GeometryResult calculateForPlot(SunObservation observation) {
        return calculate(observation, properties.getGeometry().getMaxZenithDegrees());
    }

    @VisibleForTesting
    GeometryResult calculate(SunObservation observation, double maxZenithDegrees) {
        double latitude = observation.getPosition().getLatitude();
        double longitude = observation.getPosition().getLongitude();
        var instant = observation.getInstant();

        double tzOffset = instant.getTzOffsetHours();
        LocalDateTime wallClock = instant.getLocalDateTime();
        double timeFraction = (wallClock.getHour() + wallClock.getMinute() / 60.0 + wallClock.getSecond() / 3600.0) / 24.0;
        double julianDay = JulianDay.of(instant.toInstant());
        double t = JulianDay.centuriesSinceJ2000(julianDay);

        double meanLongitude = (280.46646 + t * (36000.76983 + t * 0.0003032)) % 360.0;
        double meanAnomaly = 357.52911 + t * (35999.05029 - 0.0001537 * t);
        double eccentricity = 0.016708634 - t * (0.000042037 + 0.0000001267 * t);

        double equationOfCenter = sin(toRadians(meanAnomaly)) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + sin(toRadians(2.0 * meanAnomaly)) * (0.019993 - 0.000101 * t)
                + sin(toRadians(3.0 * meanAnomaly)) * 0.000289;

        double trueLongitude = meanLongitude + equationOfCenter;
        double trueAnomaly = meanAnomaly + equationOfCenter;
        double radianceVector = 1.000001018 * (1.0 - eccentricity * eccentricity)
                / (1.0 + eccentricity * cos(toRadians(trueAnomaly)));

        double omega = toRadians(125.04 - 1934.136 * t);
        double apparentLongitude = trueLongitude - 0.00569 - 0.00478 * sin(omega);
        double meanObliquity = 23.0 + (26.0 + (21.448 - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60.0) / 60.0;
        double obliquity = meanObliquity + 0.00256 * cos(omega);

        double rLong = toRadians(apparentLongitude);
        double rObl = toRadians(obliquity);
        double rightAscension = toDegrees(atan2(cos(rObl) * sin(rLong), cos(rLong)));
        double declination = toDegrees(asin(sin(rObl) * sin(rLong)));

        double eqOfTime = equationOfTime(obliquity, eccentricity, meanLongitude, meanAnomaly);

        double rLat = toRadians(latitude);
        double rDec = toRadians(declination);

        double haArgument = cos(toRadians(SUNRISE_ZENITH)) / (cos(rLat) * cos(rDec)) - tan(rLat) * tan(rDec);
        DaylightCondition daylight = daylightCondition(haArgument);
        double haSunrise = toDegrees(acos(clampUnit(haArgument)));

        double solarNoon = (720.0 - 4.0 * longitude - eqOfTime + tzOffset * 60.0) / 1440.0;
        double sunrise = solarNoon - haSunrise * 4.0 / 1440.0;
        double sunset = solarNoon + haSunrise * 4.0 / 1440.0;
        double sunlightDuration = 8.0 * haSunrise;

        double trueSolarTime = (timeFraction * 1440.0 + eqOfTime + 4.0 * longitude - 60.0 * tzOffset) % 1440.0;
        double hourAngle = trueSolarTime / 4.0 < 0 ? trueSolarTime / 4.0 + 180.0 : trueSolarTime / 4.0 - 180.0;

        double zenith = toDegrees(acos(clampUnit(
                sin(rLat) * sin(rDec) + cos(rLat) * cos(rDec) * cos(toRadians(hourAngle)))));
        double elevation = 90.0 - Math.min(zenith, maxZenithDegrees);
        double correctedElevation = elevation + atmosphericRefraction(elevation);

        double azimuth = solarAzimuth(rLat, rDec, toRadians(zenith), hourAngle);

        return GeometryResult.builder()
                .latitude(latitude)
                .longitude(longitude)
                .instant(instant)
                .tzOffsetHours(tzOffset)
                .julianDay(julianDay)
                .radianceVector(radianceVector)
                .rightAscensionDeg(rightAscension)
                .declinationDeg(declination)
                .equationOfTimeMinutes(eqOfTime)
                .solarNoon(toClockTime(solarNoon, "solar noon", observation))
                .sunriseTime(daylight == DaylightCondition.NORMAL ? toClockTime(sunrise, "sunrise", observation) : null)
                .sunsetTime(daylight == DaylightCondition.NORMAL ? toClockTime(sunset, "sunset", observation) : null)
                .sunlightDurationMinutes(sunlightDuration)
                .daylight(daylight)
                .hourAngleDeg(hourAngle)
                .solarZenithDeg(zenith)
                .solarElevationDeg(correctedElevation)
                .solarAzimuthDeg(azimuth)
                .build();
    }

    /**
     * Equation of time in minutes.
     */
    private static double equationOfTime(double obliquity, double eccentricity, double meanLongitude, double meanAnomaly) {
        double tanHalf = tan(toRadians(obliquity / 2.0));
        double y = tanHalf * tanHalf;
        double rMeanLong = toRadians(meanLongitude);
        double rMeanAnom = toRadians(meanAnomaly);
        return 4.0 * toDegrees(y * sin(2.0 * rMeanLong)
                - 2.0 * eccentricity * sin(rMeanAnom)
                + 4.0 * eccentricity * y * sin(rMeanAnom) * cos(2.0 * rMeanLong)
                - 0.5 * y * y * sin(4.0 * rMeanLong)
                - 1.25 * eccentricity * eccentricity * sin(2.0 * rMeanAnom));
    }

    /**
     * Approximate atmospheric refraction, in degrees, for a geometric elevation in degrees.
     */
    @VisibleForTesting
    static double atmosphericRefraction(double elevation) {
        double tanElevation = tan(toRadians(elevation));
        double arcSeconds;
        if (elevation > 85.0) {
            arcSeconds = 0.0;
        } else if (elevation > 5.0) {
            arcSeconds = 58.1 / tanElevation - 0.07 / pow(tanElevation, 3) + 0.000086 / pow(tanElevation, 5);
        } else if (elevation > -0.575) {
            arcSeconds = 1735.0 + elevation * (-518.2 + elevation * (103.4 + elevation * (-12.79 + elevation * 0.711)));
        } else {
            arcSeconds = -20.772 / tanElevation;
        }
        return arcSeconds / 3600.0;
    }

    /**
     * Azimuth clockwise from north in [0, 360).
     */
    private static double solarAzimuth(double rLat, double rDec, double rZenith, double hourAngle) {
        double angle = toDegrees(acos(clampUnit((sin(rLat) * cos(rZenith) - sin(rDec)) / (cos(rLat) * sin(rZenith)))));
        if (hourAngle > 0.0) {
            return (angle + 180.0) % 360.0;
        }
        return (540.0 - angle) % 360.0;
    }

    private static DaylightCondition daylightCondition(double haArgument) {
        if (haArgument > 1.0) {
            return DaylightCondition.POLAR_NIGHT;
        }
        if (haArgument < -1.0) {
            return DaylightCondition.POLAR_DAY;
        }
        return DaylightCondition.NORMAL;
    }

    private static double clampUnit(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    private ClockTime toClockTime(double dayFraction, String event, SunObservation observation) {
        try {
            return ClockTimes.fromDayFraction(dayFraction);
        } catch (InvalidClockTimeException e) {
            log.error("Could not convert {} day fraction {} to a clock time for {}", event, dayFraction, observation, e);
            throw e;
        }
    }
}
