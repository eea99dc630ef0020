package dev.devanks.solarlogger.engine.model;

import lombok.Value;

@Value
public class EnergyResult {

    public static final EnergyResult DARK = new EnergyResult(0.0, 0.0);

    double incidentWPerM2;
    double moduleWPerM2;
}
