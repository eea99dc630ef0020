package dev.devanks.solarlogger.engine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PanelOrientation Unit Tests")
class PanelOrientationTest {

    @ParameterizedTest
    @DisplayName("resolveFor: unset fields tilt by the latitude and face the equator")
    @CsvSource({
            "37.94,  37.94, 180.0",
            "-33.87, 33.87, 0.0",
            "0.0,    0.0,   180.0"
    })
    void resolveFor_defaults(double latitude, double expectedTilt, double expectedAzimuth) {
        var panel = PanelOrientation.defaults().resolveFor(GeoPosition.of(latitude, 10.0));

        assertThat(panel.getTiltDegrees()).isEqualTo(expectedTilt);
        assertThat(panel.getAzimuthDegrees()).isEqualTo(expectedAzimuth);
        assertThat(panel.getAltitudeKm()).isZero();
    }

    @Test
    @DisplayName("resolveFor: explicit values win over the latitude defaults")
    void resolveFor_explicitValues() {
        var panel = PanelOrientation.builder()
                .tiltDegrees(15.0)
                .azimuthDegrees(200.0)
                .altitudeKm(1.5)
                .build()
                .resolveFor(GeoPosition.of(-33.87, 151.21));

        assertThat(panel).isEqualTo(new EffectivePanel(15.0, 200.0, 1.5));
    }

    @Test
    @DisplayName("tilted: keeps the hemisphere default azimuth")
    void tilted_defaultAzimuth() {
        var panel = PanelOrientation.tilted(23.0).resolveFor(GeoPosition.of(-10.0, 0.0));

        assertThat(panel.getTiltDegrees()).isEqualTo(23.0);
        assertThat(panel.getAzimuthDegrees()).isEqualTo(PanelOrientation.NORTH_FACING_AZIMUTH);
    }
}
