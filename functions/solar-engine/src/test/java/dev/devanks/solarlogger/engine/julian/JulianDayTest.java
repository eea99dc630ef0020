package dev.devanks.solarlogger.engine.julian;

import dev.devanks.solarlogger.engine.exception.JulianDateOutOfRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("JulianDay Unit Tests")
class JulianDayTest {

    @Test
    @DisplayName("of: start of the supported range matches the astronomical Julian Day of 1950-01-01")
    void of_firstSupportedDay() {
        assertThat(JulianDay.of(Instant.parse("1950-01-01T00:00:00Z"))).isEqualTo(2433282.5);
    }

    @Test
    @DisplayName("of: J2000 epoch is 2451545.0")
    void of_j2000() {
        assertThat(JulianDay.of(Instant.parse("2000-01-01T12:00:00Z"))).isCloseTo(2451545.0, within(1e-9));
    }

    @Test
    @DisplayName("of: includes the fraction of the UTC day")
    void of_partialDay() {
        assertThat(JulianDay.of(Instant.parse("2010-06-21T19:00:00Z"))).isCloseTo(2455369.2917, within(0.0001));
        assertThat(JulianDay.of(Instant.parse("2024-09-10T19:00:00Z"))).isCloseTo(2460564.29, within(0.01));
    }

    @Test
    @DisplayName("of: last day of 2050 is still supported")
    void of_lastSupportedDay() {
        assertThat(JulianDay.of(Instant.parse("2050-12-31T23:59:59Z"))).isCloseTo(2470172.5, within(0.001));
    }

    @ParameterizedTest
    @DisplayName("of: years outside 1950-2050 fail with the offending year")
    @ValueSource(strings = {"1949-12-31T23:59:59Z", "2051-01-01T00:00:00Z", "1899-12-30T00:00:00Z"})
    void of_outOfRange_throws(String instant) {
        var parsed = Instant.parse(instant);
        assertThatThrownBy(() -> JulianDay.of(parsed))
                .isInstanceOf(JulianDateOutOfRangeException.class)
                .hasMessageContaining("outside the supported Julian Day range [1950, 2050]");
    }

    @Test
    @DisplayName("centuriesSinceJ2000: one Julian century after J2000 is 1.0")
    void centuriesSinceJ2000() {
        assertThat(JulianDay.centuriesSinceJ2000(2451545.0 + 36525.0)).isEqualTo(1.0);
    }
}
