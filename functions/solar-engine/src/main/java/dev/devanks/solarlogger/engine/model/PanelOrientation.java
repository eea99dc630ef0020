package dev.devanks.solarlogger.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Orientation of a solar module. Unset tilt and azimuth are filled in from the site latitude by
 * {@link #resolveFor(GeoPosition)}: the module is tilted by the latitude and faces the equator.
 */
@Value
@Builder
public class PanelOrientation {

    public static final double NORTH_FACING_AZIMUTH = 0.0;
    public static final double SOUTH_FACING_AZIMUTH = 180.0;

    Double tiltDegrees;
    Double azimuthDegrees;
    @Builder.Default
    double altitudeKm = 0.0;

    public static PanelOrientation defaults() {
        return PanelOrientation.builder().build();
    }

    public static PanelOrientation tilted(double tiltDegrees) {
        return PanelOrientation.builder().tiltDegrees(tiltDegrees).build();
    }

    public EffectivePanel resolveFor(GeoPosition position) {
        double tilt = tiltDegrees != null ? tiltDegrees : Math.abs(position.getLatitude());
        double azimuth;
        if (azimuthDegrees != null) {
            azimuth = azimuthDegrees;
        } else {
            azimuth = position.isSouthernHemisphere() ? NORTH_FACING_AZIMUTH : SOUTH_FACING_AZIMUTH;
        }
        return new EffectivePanel(tilt, azimuth, altitudeKm);
    }
}
