package dev.devanks.dominion.usage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.devanks.dominion.usage.exception.ErrorKind;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL) // errorKind/errorDetails only on failure
public class UsageImportResult {

    public enum Status {
        SUCCESS, FAILURE
    }

    private Status status;
    private String message;
    private Long durationMs;
    private String statisticId;
    private Integer intervalCount;
    private Integer hourlyCount;
    private Integer statisticsWritten;
    private Integer dstDroppedCount;
    private Integer dailySummaries;
    private String readingsExportPath;
    private ErrorKind errorKind;
    private String errorDetails;
}
