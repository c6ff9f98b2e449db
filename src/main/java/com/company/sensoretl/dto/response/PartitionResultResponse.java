package com.company.sensoretl.dto.response;

import com.company.sensoretl.domain.DescriptiveStats;
import com.company.sensoretl.domain.result.PartitionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartitionResultResponse {
    private LocalDate partitionDate;
    private String status;
    private int recordsExtracted;
    private int recordsInserted;
    private int bucketsProcessed;
    private Instant startedAt;
    private Instant finishedAt;
    private Map<String, DescriptiveStats> inputStatistics; // success only
    private List<String> unresolvedSignals;                // no_valid_data only
    private String failedStage;                            // error only
    private String errorDetail;                            // error only

    public static PartitionResultResponse from(PartitionResult result) {
        PartitionResultResponseBuilder builder = PartitionResultResponse.builder()
                .partitionDate(result.getPartitionDate())
                .status(result.getStatus().toWireValue())
                .recordsExtracted(result.getRecordsExtracted())
                .recordsInserted(result.getRecordsInserted())
                .bucketsProcessed(result.getBucketsProcessed())
                .startedAt(result.getStartedAt())
                .finishedAt(result.getFinishedAt());

        if (result instanceof PartitionResult.Success) {
            builder.inputStatistics(((PartitionResult.Success) result).getInputStatistics());
        } else if (result instanceof PartitionResult.NoValidData) {
            builder.unresolvedSignals(((PartitionResult.NoValidData) result).getUnresolvedSignals());
        } else if (result instanceof PartitionResult.Failed) {
            PartitionResult.Failed failed = (PartitionResult.Failed) result;
            builder.failedStage(failed.getFailedStage().name())
                    .errorDetail(failed.getErrorDetail());
        }
        return builder.build();
    }
}
