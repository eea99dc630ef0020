package dev.devanks.solarlogger.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InsolationSeriesResponse {

    /**
     * One sample, with only the requested columns set.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Row {
        private String at;
        private Double incident;
        private Double module;
    }

    private ResultStatus status;
    private String message;
    private Long durationMs;
    private List<String> items;
    private List<Row> points;
    private String errorDetails; // Only populated on failure

}
