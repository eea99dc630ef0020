package dev.devanks.solarlogger.engine.model;

public enum ResultStatus {
    SUCCESS, FAILURE
}
