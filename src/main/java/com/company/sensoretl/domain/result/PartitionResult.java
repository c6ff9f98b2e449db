package com.company.sensoretl.domain.result;

import com.company.sensoretl.domain.DescriptiveStats;
import com.company.sensoretl.domain.enums.PartitionStage;
import com.company.sensoretl.domain.enums.PartitionStatus;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one partition run. Exactly one of {@link Success}, {@link NoData},
 * {@link NoValidData} or {@link Failed}; instances are immutable.
 */
@Getter
public abstract class PartitionResult {

    private final LocalDate partitionDate;
    private final int recordsExtracted;
    private final int recordsInserted;
    private final int bucketsProcessed;
    private final Instant startedAt;
    private final Instant finishedAt;

    private PartitionResult(LocalDate partitionDate, int recordsExtracted, int recordsInserted,
                            int bucketsProcessed, Instant startedAt, Instant finishedAt) {
        this.partitionDate = partitionDate;
        this.recordsExtracted = recordsExtracted;
        this.recordsInserted = recordsInserted;
        this.bucketsProcessed = bucketsProcessed;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public abstract PartitionStatus getStatus();

    public static Success success(LocalDate date, int extracted, int inserted, int buckets,
                                  Map<String, DescriptiveStats> inputStatistics,
                                  Instant startedAt, Instant finishedAt) {
        return new Success(date, extracted, inserted, buckets, inputStatistics, startedAt, finishedAt);
    }

    public static NoData noData(LocalDate date, Instant startedAt, Instant finishedAt) {
        return new NoData(date, startedAt, finishedAt);
    }

    public static NoValidData noValidData(LocalDate date, int extracted, int buckets,
                                          List<String> unresolvedSignals,
                                          Instant startedAt, Instant finishedAt) {
        return new NoValidData(date, extracted, buckets, unresolvedSignals, startedAt, finishedAt);
    }

    public static Failed failed(LocalDate date, int extracted, int insertedBeforeFailure, int buckets,
                                PartitionStage failedStage, String errorDetail,
                                Instant startedAt, Instant finishedAt) {
        return new Failed(date, extracted, insertedBeforeFailure, buckets,
                failedStage, errorDetail, startedAt, finishedAt);
    }

    @Getter
    public static final class Success extends PartitionResult {
        private final Map<String, DescriptiveStats> inputStatistics;

        private Success(LocalDate date, int extracted, int inserted, int buckets,
                        Map<String, DescriptiveStats> inputStatistics,
                        Instant startedAt, Instant finishedAt) {
            super(date, extracted, inserted, buckets, startedAt, finishedAt);
            this.inputStatistics = Map.copyOf(inputStatistics);
        }

        @Override
        public PartitionStatus getStatus() {
            return PartitionStatus.SUCCESS;
        }
    }

    public static final class NoData extends PartitionResult {
        private NoData(LocalDate date, Instant startedAt, Instant finishedAt) {
            super(date, 0, 0, 0, startedAt, finishedAt);
        }

        @Override
        public PartitionStatus getStatus() {
            return PartitionStatus.NO_DATA;
        }
    }

    @Getter
    public static final class NoValidData extends PartitionResult {
        private final List<String> unresolvedSignals;

        private NoValidData(LocalDate date, int extracted, int buckets, List<String> unresolvedSignals,
                            Instant startedAt, Instant finishedAt) {
            super(date, extracted, 0, buckets, startedAt, finishedAt);
            this.unresolvedSignals = List.copyOf(unresolvedSignals);
        }

        @Override
        public PartitionStatus getStatus() {
            return PartitionStatus.NO_VALID_DATA;
        }
    }

    /**
     * {@link #getRecordsInserted()} holds the rows committed before the failure.
     */
    @Getter
    public static final class Failed extends PartitionResult {
        private final PartitionStage failedStage;
        private final String errorDetail;

        private Failed(LocalDate date, int extracted, int insertedBeforeFailure, int buckets,
                       PartitionStage failedStage, String errorDetail,
                       Instant startedAt, Instant finishedAt) {
            super(date, extracted, insertedBeforeFailure, buckets, startedAt, finishedAt);
            this.failedStage = failedStage;
            this.errorDetail = errorDetail;
        }

        @Override
        public PartitionStatus getStatus() {
            return PartitionStatus.ERROR;
        }
    }
}
