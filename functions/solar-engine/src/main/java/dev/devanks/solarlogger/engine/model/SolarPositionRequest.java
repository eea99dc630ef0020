package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolarPositionRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;     // Defaults to the configured site

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    private String dateTime;     // Local wall time, ISO-8601 (2024-09-10T12:00:00); defaults to now
    private String timeZone;     // IANA zone id; defaults to the configured site zone

    @DecimalMin("0.0")
    @DecimalMax("180.0")
    private Double panelTilt;

    @DecimalMin("0.0")
    @DecimalMax("360.0")
    private Double panelAzimuth;

    @DecimalMin("0.0")
    @DecimalMax("3.0")
    private Double altitudeKm;
}
