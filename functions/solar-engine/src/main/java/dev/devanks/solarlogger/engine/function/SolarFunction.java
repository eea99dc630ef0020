package dev.devanks.solarlogger.engine.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solarlogger.engine.config.SolarProperties;
import dev.devanks.solarlogger.engine.model.CivilInstant;
import dev.devanks.solarlogger.engine.model.GeoPosition;
import dev.devanks.solarlogger.engine.model.InsolationPoint;
import dev.devanks.solarlogger.engine.model.InsolationSeriesRequest;
import dev.devanks.solarlogger.engine.model.InsolationSeriesResponse;
import dev.devanks.solarlogger.engine.model.PanelOrientation;
import dev.devanks.solarlogger.engine.model.ResultStatus;
import dev.devanks.solarlogger.engine.model.SamplingStep;
import dev.devanks.solarlogger.engine.model.SeriesItem;
import dev.devanks.solarlogger.engine.model.SolarPositionRequest;
import dev.devanks.solarlogger.engine.model.SolarPositionResponse;
import dev.devanks.solarlogger.engine.service.SolarEngine;
import dev.devanks.solarlogger.engine.time.AmbiguousLocalTime;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SolarFunction {

    private final SolarEngine solarEngine;
    private final SolarProperties properties;
    private final Validator validator;

    /**
     * Function bean: solarPosition. Geometry and irradiance at one local date-time.
     */
    @Bean
    public Function<SolarPositionRequest, SolarPositionResponse> solarPosition() {
        return request -> {
            log.info("solarPosition function triggered with payload: {}", request);
            try {
                return computePosition(request == null ? new SolarPositionRequest() : request);
            } catch (Exception e) {
                log.error("Error computing solar position for payload {}: {}", request, e.getMessage(), e);
                return SolarPositionResponse.builder()
                        .status(ResultStatus.FAILURE)
                        .message("Solar position calculation failed.")
                        .errorDetails(e.getMessage())
                        .build();
            }
        };
    }

    /**
     * Function bean: insolationSeries. Irradiance sampled over a date and time-of-day window.
     */
    @Bean
    public Function<InsolationSeriesRequest, InsolationSeriesResponse> insolationSeries() {
        return request -> {
            log.info("insolationSeries function triggered with payload: {}", request);
            if (request == null) {
                return seriesFailure("Missing payload.", "A payload with 'from' and 'to' is required.");
            }
            try {
                return computeSeries(request);
            } catch (Exception e) {
                log.error("Error sampling insolation series for payload {}: {}", request, e.getMessage(), e);
                return seriesFailure("Insolation series sampling failed.", e.getMessage());
            }
        };
    }

    @VisibleForTesting
    SolarPositionResponse computePosition(SolarPositionRequest request) {
        String violations = violations(request);
        if (violations != null) {
            return SolarPositionResponse.builder()
                    .status(ResultStatus.FAILURE)
                    .message("Invalid payload.")
                    .errorDetails(violations)
                    .build();
        }

        var position = positionOf(request.getLatitude(), request.getLongitude());
        var timeZone = ZoneId.of(request.getTimeZone() != null ? request.getTimeZone() : properties.getSite().getTimeZone());
        var localDateTime = request.getDateTime() != null
                ? LocalDateTime.parse(request.getDateTime())
                : LocalDateTime.now(timeZone).truncatedTo(ChronoUnit.SECONDS);

        var conversion = solarEngine.toZone(localDateTime, timeZone);
        if (conversion instanceof AmbiguousLocalTime ambiguous) {
            log.warn("Local time {} in {} is {} ({} / {})", localDateTime, timeZone, ambiguous.getKind(),
                    ambiguous.getBefore(), ambiguous.getAfter());
            return SolarPositionResponse.builder()
                    .status(ResultStatus.FAILURE)
                    .message("Local time does not map to a single instant.")
                    .errorDetails(String.format("%s %s in %s: candidates %s and %s", ambiguous.getKind(), localDateTime,
                            timeZone, ambiguous.getBefore(), ambiguous.getAfter()))
                    .build();
        }

        CivilInstant instant = conversion.resolved().orElseThrow();
        var panel = panelOf(request.getPanelTilt(), request.getPanelAzimuth(), request.getAltitudeKm());
        var geometry = solarEngine.solarGeometry(position, instant);
        var energy = solarEngine.solarEnergy(position, instant, panel);

        return SolarPositionResponse.builder()
                .status(ResultStatus.SUCCESS)
                .message(String.format("Solar position for %s at %s.", position, instant))
                .geometry(geometry)
                .energy(energy)
                .build();
    }

    @VisibleForTesting
    InsolationSeriesResponse computeSeries(InsolationSeriesRequest request) {
        String violations = violations(request);
        if (violations != null) {
            return seriesFailure("Invalid payload.", violations);
        }

        Instant start = Instant.now();
        var position = positionOf(request.getLatitude(), request.getLongitude());
        var timeZone = request.getTimeZone() != null ? ZoneId.of(request.getTimeZone()) : ZoneOffset.UTC;
        var step = stepOf(request.getIntervalAmount(), request.getIntervalUnit());
        var panel = panelOf(request.getPanelTilt(), request.getPanelAzimuth(), request.getAltitudeKm());
        Set<SeriesItem> items = itemsOf(request.getItems());
        var from = LocalDateTime.parse(request.getFrom());
        var to = LocalDateTime.parse(request.getTo());

        List<InsolationPoint> points = solarEngine.sampleSeries(position, panel, from, to, timeZone, step).block();
        List<InsolationSeriesResponse.Row> rows = points == null ? List.of() : points.stream()
                .map(point -> toRow(point, items))
                .toList();

        long duration = ChronoUnit.MILLIS.between(start, Instant.now());
        return InsolationSeriesResponse.builder()
                .status(ResultStatus.SUCCESS)
                .message(rows.isEmpty() ? "Nothing to plot." : String.format("Sampled %d points.", rows.size()))
                .durationMs(duration)
                .items(items.stream().map(SeriesItem::columnName).toList())
                .points(rows)
                .build();
    }

    private InsolationSeriesResponse.Row toRow(InsolationPoint point, Set<SeriesItem> items) {
        return InsolationSeriesResponse.Row.builder()
                .at(point.getAt().toString())
                .incident(items.contains(SeriesItem.INCIDENT) ? SeriesItem.INCIDENT.valueOf(point) : null)
                .module(items.contains(SeriesItem.MODULE) ? SeriesItem.MODULE.valueOf(point) : null)
                .build();
    }

    private GeoPosition positionOf(Double latitude, Double longitude) {
        var site = properties.getSite();
        return GeoPosition.of(
                latitude != null ? latitude : site.getLatitude(),
                longitude != null ? longitude : site.getLongitude());
    }

    private static PanelOrientation panelOf(Double tilt, Double azimuth, Double altitudeKm) {
        return PanelOrientation.builder()
                .tiltDegrees(tilt)
                .azimuthDegrees(azimuth)
                .altitudeKm(altitudeKm != null ? altitudeKm : 0.0)
                .build();
    }

    @VisibleForTesting
    SamplingStep stepOf(Integer amount, String unit) {
        var sampling = properties.getSampling();
        int effectiveAmount = amount != null ? amount : sampling.getIntervalAmount();
        if (unit == null) {
            return new SamplingStep(effectiveAmount, sampling.getIntervalUnit());
        }
        return switch (unit.trim().toLowerCase(Locale.ROOT)) {
            case "hour", "hours" -> SamplingStep.hours(effectiveAmount);
            case "minute", "minutes" -> SamplingStep.minutes(effectiveAmount);
            default -> throw new IllegalArgumentException("Unsupported interval unit '" + unit + "', use 'hour' or 'minute'");
        };
    }

    private static Set<SeriesItem> itemsOf(List<String> names) {
        if (names == null || names.isEmpty()) {
            return EnumSet.allOf(SeriesItem.class);
        }
        return names.stream()
                .map(SeriesItem::parse)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(SeriesItem.class)));
    }

    private <T> String violations(T request) {
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
    }

    private static InsolationSeriesResponse seriesFailure(String message, String details) {
        return InsolationSeriesResponse.builder()
                .status(ResultStatus.FAILURE)
                .message(message)
                .errorDetails(details)
                .build();
    }
}
