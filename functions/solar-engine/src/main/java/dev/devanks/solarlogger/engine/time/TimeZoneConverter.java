package dev.devanks.solarlogger.engine.time;

import dev.devanks.solarlogger.engine.model.CivilInstant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;

@Component
@Slf4j
public class TimeZoneConverter {

    /**
     * Expresses an instant on the wall clock of another zone. An absolute instant always has exactly
     * one reading, so the result is a {@link ResolvedTime}. Converting to the zone the instant is
     * already in returns it unchanged.
     *
     * @param instant  The instant to convert.
     * @param timeZone The target zone.
     * @return The instant in the target zone.
     */
    public ZoneConversion toZone(CivilInstant instant, ZoneId timeZone) {
        if (instant.getZone().equals(timeZone)) {
            return new ResolvedTime(instant);
        }
        return new ResolvedTime(CivilInstant.of(instant.getDateTime().withZoneSameInstant(timeZone)));
    }

    /**
     * Places a wall clock reading in a zone. Readings that fall in a spring-forward gap or a
     * fall-back overlap are reported as an {@link AmbiguousLocalTime} instead of being adjusted.
     *
     * @param localDateTime The wall clock reading.
     * @param timeZone      The zone the reading belongs to.
     * @return The resolved instant, or both candidates around the transition.
     */
    public ZoneConversion toZone(LocalDateTime localDateTime, ZoneId timeZone) {
        ZoneRules rules = timeZone.getRules();
        List<ZoneOffset> validOffsets = rules.getValidOffsets(localDateTime);

        if (validOffsets.size() == 1) {
            return new ResolvedTime(CivilInstant.of(ZonedDateTime.ofStrict(localDateTime, validOffsets.get(0), timeZone)));
        }

        ZoneOffsetTransition transition = rules.getTransition(localDateTime);
        if (validOffsets.isEmpty()) {
            log.debug("Local time {} falls in a gap in zone {} (transition at {})", localDateTime, timeZone, transition.getInstant());
            var before = ZonedDateTime.ofInstant(transition.getInstant().minusNanos(1), timeZone);
            var after = ZonedDateTime.ofInstant(transition.getInstant(), timeZone);
            return new AmbiguousLocalTime(CivilInstant.of(before), CivilInstant.of(after), TransitionKind.GAP);
        }

        log.debug("Local time {} is ambiguous in zone {} (offsets {})", localDateTime, timeZone, validOffsets);
        var before = ZonedDateTime.ofLocal(localDateTime, timeZone, transition.getOffsetBefore());
        var after = ZonedDateTime.ofLocal(localDateTime, timeZone, transition.getOffsetAfter());
        return new AmbiguousLocalTime(CivilInstant.of(before), CivilInstant.of(after), TransitionKind.AMBIGUOUS);
    }

    public ZoneConversion toUtc(CivilInstant instant) {
        return toZone(instant, ZoneOffset.UTC);
    }

    public ZoneConversion toUtc(LocalDateTime localDateTime) {
        return toZone(localDateTime, ZoneOffset.UTC);
    }
}
