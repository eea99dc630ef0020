package dev.devanks.solarlogger.engine.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A point on the earth in decimal degrees. Latitude is positive north, longitude positive east.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class GeoPosition {
    double latitude;
    double longitude;

    public boolean isSouthernHemisphere() {
        return latitude < 0;
    }
}
