package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * An absolute instant read on the wall clock of a civil time zone.
 * <p>
 * The total UTC offset is split the way time zone databases report it: {@link #getUtcOffsetSeconds()}
 * is the zone's standard offset and {@link #getStdOffsetSeconds()} the daylight saving amount in force.
 * <p>
 * Note: the natural ordering is inconsistent with equals. {@link #compareTo(CivilInstant)} orders by
 * instant only, while {@link #equals(Object)} also compares the zone, so the same instant read in two
 * zones compares as 0 but is not equal. Do not put values from mixed zones in a sorted set or map.
 */
@Value
public class CivilInstant implements Comparable<CivilInstant> {

    @NonNull
    ZonedDateTime dateTime;

    public static CivilInstant of(ZonedDateTime dateTime) {
        return new CivilInstant(dateTime);
    }

    public static CivilInstant utc(Instant instant) {
        return new CivilInstant(instant.atZone(ZoneOffset.UTC));
    }

    public Instant toInstant() {
        return dateTime.toInstant();
    }

    @JsonIgnore
    public ZoneId getZone() {
        return dateTime.getZone();
    }

    @JsonIgnore
    public LocalDateTime getLocalDateTime() {
        return dateTime.toLocalDateTime();
    }

    public int getUtcOffsetSeconds() {
        return getZone().getRules().getStandardOffset(toInstant()).getTotalSeconds();
    }

    public int getStdOffsetSeconds() {
        return dateTime.getOffset().getTotalSeconds() - getUtcOffsetSeconds();
    }

    public double getTzOffsetHours() {
        return (getUtcOffsetSeconds() + getStdOffsetSeconds()) / 3600.0;
    }

    @Override
    public int compareTo(CivilInstant other) {
        return toInstant().compareTo(other.toInstant());
    }

    @Override
    public String toString() {
        return dateTime.toString();
    }
}
