package dev.devanks.solarlogger.engine.model;

import lombok.Value;

/**
 * Panel orientation with every default applied.
 */
@Value
public class EffectivePanel {
    double tiltDegrees;
    double azimuthDegrees;
    double altitudeKm;
}
