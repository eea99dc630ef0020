package dev.devanks.solarlogger.engine.time;

import dev.devanks.solarlogger.engine.model.CivilInstant;

import java.util.Optional;

/**
 * Outcome of placing a time in a civil zone: either a single {@link ResolvedTime} or an
 * {@link AmbiguousLocalTime} carrying both candidates around a daylight saving transition.
 */
public interface ZoneConversion {

    /**
     * @return the converted instant, or empty when the wall time is a gap or ambiguous.
     */
    Optional<CivilInstant> resolved();

    default boolean isResolved() {
        return resolved().isPresent();
    }
}
