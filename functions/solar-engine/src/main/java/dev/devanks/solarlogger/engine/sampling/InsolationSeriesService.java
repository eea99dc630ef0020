package dev.devanks.solarlogger.engine.sampling;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarlogger.engine.config.SolarProperties;
import dev.devanks.solarlogger.engine.energy.SolarEnergyCalculator;
import dev.devanks.solarlogger.engine.exception.SolarCalculationException;
import dev.devanks.solarlogger.engine.geometry.SolarGeometryCalculator;
import dev.devanks.solarlogger.engine.model.GeoPosition;
import dev.devanks.solarlogger.engine.model.InsolationPoint;
import dev.devanks.solarlogger.engine.model.PanelOrientation;
import dev.devanks.solarlogger.engine.model.SamplingStep;
import dev.devanks.solarlogger.engine.model.SunObservation;
import dev.devanks.solarlogger.engine.time.AmbiguousLocalTime;
import dev.devanks.solarlogger.engine.time.TimeZoneConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static reactor.core.scheduler.Schedulers.parallel;

@Service
@RequiredArgsConstructor
@Slf4j
public class InsolationSeriesService {

    private final SolarProperties properties;
    private final TimeZoneConverter timeZoneConverter;
    private final SolarGeometryCalculator geometryCalculator;
    private final SolarEnergyCalculator energyCalculator;

    /**
     * Samples ground and module irradiance over every date from {@code from} to {@code to}, each between
     * the same two wall clock times. Grid points that fall in a daylight saving gap or overlap, or whose
     * calculation fails, are left out.
     *
     * @param position The site.
     * @param panel    The module orientation.
     * @param from     The first date and the first time of day to sample.
     * @param to       The last date and the last time of day to sample.
     * @param timeZone The zone the wall clock times are read in.
     * @param step     Spacing between samples within a day.
     * @return A Mono emitting the points in chronological order.
     */
    public Mono<List<InsolationPoint>> sampleSeries(GeoPosition position, PanelOrientation panel,
                                                    LocalDateTime from, LocalDateTime to,
                                                    ZoneId timeZone, SamplingStep step) {
        List<LocalDateTime> grid;
        try {
            grid = buildGrid(from, to, step);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping insolation series for {} in {}: {}", position, timeZone, e.getMessage());
            return Mono.just(Collections.emptyList());
        }

        log.info("Sampling {} grid points for {} in {} from {} to {} every {} {}",
                grid.size(), position, timeZone, from, to, step.getAmount(), step.getUnit());
        Instant start = Instant.now();

        return Flux.fromIterable(grid)
                .parallel(properties.getSampling().getParallelism())
                .runOn(parallel())
                .flatMap(localDateTime -> Mono.justOrEmpty(samplePoint(position, panel, localDateTime, timeZone)))
                .sequential()
                .collectSortedList(Comparator.comparing(InsolationPoint::getAt))
                .doOnSuccess(points -> log.info("Sampled {} of {} grid points in {} ms.",
                        points.size(), grid.size(), ChronoUnit.MILLIS.between(start, Instant.now())))
                .doOnError(e -> log.error("Insolation sampling for {} failed: {}", position, e.getMessage(), e));
    }

    /**
     * Cross product of the date range and the time-of-day range, date major.
     */
    @VisibleForTesting
    List<LocalDateTime> buildGrid(LocalDateTime from, LocalDateTime to, SamplingStep step) {
        List<LocalDate> dates = RangeSampler.dateRange(from.toLocalDate(), to.toLocalDate());
        List<LocalTime> times = RangeSampler.timeRange(from.toLocalTime(), to.toLocalTime(), step);
        return dates.stream()
                .flatMap(date -> times.stream().map(date::atTime))
                .toList();
    }

    @VisibleForTesting
    Optional<InsolationPoint> samplePoint(GeoPosition position, PanelOrientation panel,
                                          LocalDateTime localDateTime, ZoneId timeZone) {
        var conversion = timeZoneConverter.toZone(localDateTime, timeZone);
        if (conversion instanceof AmbiguousLocalTime ambiguous) {
            log.debug("Dropping {} in {}: {} between {} and {}",
                    localDateTime, timeZone, ambiguous.getKind(), ambiguous.getBefore(), ambiguous.getAfter());
            return Optional.empty();
        }
        return conversion.resolved().flatMap(instant -> {
            try {
                var geometry = geometryCalculator.calculateForPlot(SunObservation.of(position, instant));
                var energy = energyCalculator.calculate(geometry, panel);
                return Optional.of(new InsolationPoint(instant, energy.getIncidentWPerM2(), energy.getModuleWPerM2()));
            } catch (SolarCalculationException e) {
                log.warn("Dropping {} from series: {}", instant, e.getMessage());
                return Optional.empty();
            }
        });
    }
}
