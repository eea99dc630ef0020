package dev.devanks.solarlogger.engine.time;

import dev.devanks.solarlogger.engine.model.CivilInstant;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A wall clock time that does not map to exactly one instant.
 * <p>
 * For a {@link TransitionKind#GAP}, {@code before} is the last instant before the clocks jumped and
 * {@code after} the first instant after. For {@link TransitionKind#AMBIGUOUS}, {@code before} reads the
 * wall time with the earlier (daylight) offset and {@code after} with the later one.
 */
@Value
public class AmbiguousLocalTime implements ZoneConversion {

    @NonNull
    CivilInstant before;
    @NonNull
    CivilInstant after;
    @NonNull
    TransitionKind kind;

    @Override
    public Optional<CivilInstant> resolved() {
        return Optional.empty();
    }
}
