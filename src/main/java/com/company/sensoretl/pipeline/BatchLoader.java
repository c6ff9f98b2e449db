package com.company.sensoretl.pipeline;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.LoadRecord;
import com.company.sensoretl.exception.LoadFailureException;
import com.company.sensoretl.repository.SignalDataRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Appends load records in fixed-size batches, one transaction per batch.
 * <p>
 * Not all-or-nothing: when a batch fails, earlier batches stay committed and the rest are skipped.
 * The failure carries the number of rows already committed. Re-running a loaded partition hits
 * the (timestamp, signal_id) unique key and fails the same way.
 */
@Component
@Slf4j
public class BatchLoader {

    private final SignalDataRepository dataRepository;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public BatchLoader(SignalDataRepository dataRepository, TransactionTemplate transactionTemplate,
                       EtlProperties properties) {
        int batchSize = properties.getLoad().getBatchSize();
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.dataRepository = dataRepository;
        this.transactionTemplate = transactionTemplate;
        this.batchSize = batchSize;
    }

    /**
     * @return exact number of rows written
     * @throws LoadFailureException when a batch is rejected
     */
    public int load(List<LoadRecord> records) {
        int committed = 0;
        int batchNumber = 0;

        for (int from = 0; from < records.size(); from += batchSize) {
            List<LoadRecord> batch = records.subList(from, Math.min(from + batchSize, records.size()));
            batchNumber++;

            Integer written;
            try {
                written = transactionTemplate.execute(status -> dataRepository.insertBatch(batch));
            } catch (RuntimeException e) {
                log.error("Load batch {} ({} rows) failed; {} rows committed before it",
                        batchNumber, batch.size(), committed, e);
                throw new LoadFailureException(committed, batchNumber, e);
            }

            committed += written != null ? written : 0;
            log.debug("Load batch {} committed {} rows", batchNumber, written);
        }

        log.info("Loaded {} rows in {} batches (batch size {})", committed, batchNumber, batchSize);
        return committed;
    }
}
