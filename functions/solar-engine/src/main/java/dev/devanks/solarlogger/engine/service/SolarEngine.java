package dev.devanks.solarlogger.engine.service;

import dev.devanks.solarlogger.engine.energy.SolarEnergyCalculator;
import dev.devanks.solarlogger.engine.geometry.SolarGeometryCalculator;
import dev.devanks.solarlogger.engine.model.CivilInstant;
import dev.devanks.solarlogger.engine.model.EnergyResult;
import dev.devanks.solarlogger.engine.model.GeoPosition;
import dev.devanks.solarlogger.engine.model.GeometryResult;
import dev.devanks.solarlogger.engine.model.InsolationPoint;
import dev.devanks.solarlogger.engine.model.PanelOrientation;
import dev.devanks.solarlogger.engine.model.SamplingStep;
import dev.devanks.solarlogger.engine.model.SunObservation;
import dev.devanks.solarlogger.engine.sampling.InsolationSeriesService;
import dev.devanks.solarlogger.engine.time.TimeZoneConverter;
import dev.devanks.solarlogger.engine.time.ZoneConversion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Entry points of the engine for the ingestion and charting side of the solar logger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SolarEngine {

    private final SolarGeometryCalculator geometryCalculator;
    private final SolarEnergyCalculator energyCalculator;
    private final InsolationSeriesService insolationSeriesService;
    private final TimeZoneConverter timeZoneConverter;

    /**
     * @throws dev.devanks.solarlogger.engine.exception.JulianDateOutOfRangeException if the instant is
     *                                                                                 outside 1950-2050.
     */
    public GeometryResult solarGeometry(GeoPosition position, CivilInstant instant) {
        log.debug("Computing solar geometry for {} at {}", position, instant);
        return geometryCalculator.calculate(SunObservation.of(position, instant));
    }

    public EnergyResult solarEnergy(GeoPosition position, CivilInstant instant, PanelOrientation panel) {
        log.debug("Computing solar energy for {} at {} with {}", position, instant, panel);
        return energyCalculator.calculate(SunObservation.of(position, instant), panel);
    }

    public Mono<List<InsolationPoint>> sampleSeries(GeoPosition position, PanelOrientation panel,
                                                    LocalDateTime from, LocalDateTime to,
                                                    ZoneId timeZone, SamplingStep step) {
        return insolationSeriesService.sampleSeries(position, panel, from, to, timeZone, step);
    }

    public ZoneConversion toZone(CivilInstant instant, ZoneId timeZone) {
        return timeZoneConverter.toZone(instant, timeZone);
    }

    public ZoneConversion toZone(LocalDateTime localDateTime, ZoneId timeZone) {
        return timeZoneConverter.toZone(localDateTime, timeZone);
    }

    public ZoneConversion toUtc(CivilInstant instant) {
        return timeZoneConverter.toUtc(instant);
    }

    public ZoneConversion toUtc(LocalDateTime localDateTime) {
        return timeZoneConverter.toUtc(localDateTime);
    }
}
