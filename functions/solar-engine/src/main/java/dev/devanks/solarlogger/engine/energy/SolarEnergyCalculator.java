package dev.devanks.solarlogger.engine.energy;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarlogger.engine.config.SolarProperties;
import dev.devanks.solarlogger.engine.geometry.SolarGeometryCalculator;
import dev.devanks.solarlogger.engine.model.EffectivePanel;
import dev.devanks.solarlogger.engine.model.EnergyResult;
import dev.devanks.solarlogger.engine.model.GeoPosition;
import dev.devanks.solarlogger.engine.model.GeometryResult;
import dev.devanks.solarlogger.engine.model.PanelOrientation;
import dev.devanks.solarlogger.engine.model.SunObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static java.lang.Math.cos;
import static java.lang.Math.pow;
import static java.lang.Math.sin;
import static java.lang.Math.toRadians;

/**
 * Direct beam irradiance at the ground and on a tilted module, after
 * https://www.pveducation.org/pvcdrom/properties-of-sunlight/air-mass and
 * https://www.pveducation.org/pvcdrom/properties-of-sunlight/arbitrary-orientation-and-tilt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SolarEnergyCalculator {

    // Empirical altitude constant, valid for 0 <= h <= 3 km
    private static final double ALTITUDE_CONSTANT = 0.14;
    // Share of radiation at the top of the atmosphere that reaches the ground
    private static final double ATMOSPHERIC_TRANSMITTANCE = 0.7;
    private static final double AIR_MASS_EXPONENT = 0.678;

    private final SolarProperties properties;
    private final SolarGeometryCalculator geometryCalculator;

    public EnergyResult calculate(SunObservation observation, PanelOrientation panel) {
        return calculate(geometryCalculator.calculate(observation), panel);
    }

    /**
     * @param geometry The sun geometry at the site.
     * @param panel    The module orientation, unset fields defaulting from the site latitude.
     * @return Incident and module irradiance in W/m2, both zero while the sun is below the horizon.
     */
    public EnergyResult calculate(GeometryResult geometry, PanelOrientation panel) {
        double alpha = geometry.getSolarElevationDeg();
        if (alpha <= 0.0) {
            return EnergyResult.DARK;
        }

        EffectivePanel effective = panel.resolveFor(GeoPosition.of(geometry.getLatitude(), geometry.getLongitude()));
        double airMass = airMass(alpha);
        double h = effective.getAltitudeKm();
        double incident = properties.getEnergy().getExtraterrestrialIrradiance()
                * ((1.0 - ALTITUDE_CONSTANT * h) * pow(ATMOSPHERIC_TRANSMITTANCE, pow(airMass, AIR_MASS_EXPONENT))
                + ALTITUDE_CONSTANT * h);

        double module = incident * orientationFactor(alpha, geometry.getSolarAzimuthDeg(), effective);
        log.trace("Elevation {} air mass {} incident {} module {} for panel {}", alpha, airMass, incident, module, effective);
        return new EnergyResult(incident, module);
    }

    /**
     * Kasten and Young (1989). The elevation enters the curvature term in degrees, as in the published fit.
     */
    @VisibleForTesting
    static double airMass(double elevationDegrees) {
        return 1.0 / (sin(toRadians(elevationDegrees)) + 0.50572 * pow(6.07995 + elevationDegrees, -1.6364));
    }

    /**
     * Projection of the beam onto the module normal. Negative when the module faces away from the sun.
     */
    @VisibleForTesting
    static double orientationFactor(double elevationDegrees, double sunAzimuthDegrees, EffectivePanel panel) {
        double alpha = toRadians(elevationDegrees);
        double beta = toRadians(panel.getTiltDegrees());
        return cos(alpha) * sin(beta) * cos(toRadians(panel.getAzimuthDegrees() - sunAzimuthDegrees))
                + sin(alpha) * cos(beta);
    }
}
