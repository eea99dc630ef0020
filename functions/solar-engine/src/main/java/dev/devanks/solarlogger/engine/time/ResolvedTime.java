package dev.devanks.solarlogger.engine.time;

import dev.devanks.solarlogger.engine.model.CivilInstant;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

@Value
public class ResolvedTime implements ZoneConversion {

    @NonNull
    CivilInstant instant;

    @Override
    public Optional<CivilInstant> resolved() {
        return Optional.of(instant);
    }
}
