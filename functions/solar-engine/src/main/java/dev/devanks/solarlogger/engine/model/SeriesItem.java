package dev.devanks.solarlogger.engine.model;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Columns of an insolation series a plot can ask for.
 */
public enum SeriesItem {
    INCIDENT(InsolationPoint::getIncidentWPerM2),
    MODULE(InsolationPoint::getModuleWPerM2);

    private final ToDoubleFunction<InsolationPoint> extractor;

    SeriesItem(ToDoubleFunction<InsolationPoint> extractor) {
        this.extractor = extractor;
    }

    public double valueOf(InsolationPoint point) {
        return extractor.applyAsDouble(point);
    }

    public String columnName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an item name case-insensitively, so "Incident" and "module" are both accepted.
     */
    public static SeriesItem parse(String name) {
        return SeriesItem.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
