package dev.devanks.solarlogger.engine.model;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class SunObservation {
    @NonNull
    GeoPosition position;
    @NonNull
    CivilInstant instant;
}
