package dev.devanks.solarlogger.engine.time;

public enum TransitionKind {
    /**
     * Clocks jumped forward, the wall time never happened.
     */
    GAP,
    /**
     * Clocks fell back, the wall time happened twice.
     */
    AMBIGUOUS
}
