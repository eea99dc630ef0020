package dev.devanks.solarlogger.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.temporal.ChronoUnit;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "solar")
public class SolarProperties {

    /**
     * Extraterrestrial irradiance used by the ground incident model, in W/m2.
     * 1353 is the solar constant; a sensor-calibrated deployment may use about 1000.
     */
    public static final double STANDARD_EXTRATERRESTRIAL_IRRADIANCE = 1353.0;

    // Site used when a request carries no coordinates or zone
    @Data
    @Validated
    public static class SiteProperties {
        @NotEmpty
        private String name = "Kentfield";
        @DecimalMin("-90.0")
        @DecimalMax("90.0")
        private double latitude = 37.94;
        @DecimalMin("-180.0")
        @DecimalMax("180.0")
        private double longitude = -122.55;
        @NotEmpty
        private String timeZone = "America/Los_Angeles";
    }

    @Data
    @Validated
    public static class EnergyProperties {
        @Positive
        private double extraterrestrialIrradiance = STANDARD_EXTRATERRESTRIAL_IRRADIANCE;
    }

    @Data
    @Validated
    public static class GeometryProperties {
        /**
         * Largest raw zenith angle fed into the refraction correction when sampling for plots.
         */
        @DecimalMin("90.0")
        @DecimalMax("180.0")
        private double maxZenithDegrees = 99.0;
    }

    @Data
    @Validated
    public static class SamplingProperties {
        @Positive
        private int intervalAmount = 10;
        @NotNull
        private ChronoUnit intervalUnit = ChronoUnit.MINUTES;
        @Min(1)
        @Max(64)
        private int parallelism = 4;
    }

    @Valid
    @NotNull
    private SiteProperties site = new SiteProperties();

    @Valid
    @NotNull
    private EnergyProperties energy = new EnergyProperties();

    @Valid
    @NotNull
    private GeometryProperties geometry = new GeometryProperties();

    @Valid
    @NotNull
    private SamplingProperties sampling = new SamplingProperties();
}
