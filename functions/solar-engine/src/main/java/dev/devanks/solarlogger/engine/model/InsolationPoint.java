package dev.devanks.solarlogger.engine.model;

import lombok.Value;

@Value
public class InsolationPoint {
    CivilInstant at;
    double incidentWPerM2;
    double moduleWPerM2;
}
