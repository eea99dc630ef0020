package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolarPositionResponse {

    private ResultStatus status;
    private String message;
    private GeometryResult geometry;
    private EnergyResult energy;
    private String errorDetails; // Only populated on failure

}
