package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InsolationSeriesRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @NotEmpty
    private String from;         // Local wall time, ISO-8601
    @NotEmpty
    private String to;

    private String timeZone;     // Defaults to UTC

    @Positive
    private Integer intervalAmount;
    private String intervalUnit; // "hour" or "minute"

    @DecimalMin("0.0")
    @DecimalMax("180.0")
    private Double panelTilt;

    @DecimalMin("0.0")
    @DecimalMax("360.0")
    private Double panelAzimuth;

    @DecimalMin("0.0")
    @DecimalMax("3.0")
    private Double altitudeKm;

    private List<String> items;  // "Incident", "Module"; both when empty
}
