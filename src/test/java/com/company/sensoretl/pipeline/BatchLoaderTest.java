package com.company.sensoretl.pipeline;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.LoadRecord;
import com.company.sensoretl.exception.LoadFailureException;
import com.company.sensoretl.repository.SignalDataRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchLoaderTest {

    @Mock
    private SignalDataRepository dataRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Test
    void load_shouldSplitIntoBatchesOfConfiguredSize() {
        when(dataRepository.insertBatch(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        BatchLoader loader = loader(1000);

        int inserted = loader.load(records(2500));

        assertEquals(2500, inserted);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LoadRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(dataRepository, times(3)).insertBatch(captor.capture());
        assertEquals(List.of(1000, 1000, 500),
                captor.getAllValues().stream().map(List::size).collect(Collectors.toList()));
        verify(transactionManager, times(3)).commit(null);
    }

    @Test
    void load_shouldWriteSameCountForAnyBatchSize() {
        when(dataRepository.insertBatch(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        List<LoadRecord> records = records(37);

        assertEquals(37, loader(1).load(records));
        assertEquals(37, loader(7).load(records));
        assertEquals(37, loader(1000).load(records));
    }

    @Test
    void load_shouldReportRowsCommittedBeforeFailedBatch() {
        when(dataRepository.insertBatch(anyList()))
                .thenReturn(1000)
                .thenReturn(1000)
                .thenThrow(new DuplicateKeyException("uq_data_timestamp_signal"));
        BatchLoader loader = loader(1000);

        LoadFailureException e = assertThrows(LoadFailureException.class, () -> loader.load(records(3500)));

        assertEquals(2000, e.getRowsCommitted());
        assertEquals(3, e.getFailedBatch());
        verify(dataRepository, times(3)).insertBatch(anyList());
        verify(transactionManager).rollback(null);
    }

    @Test
    void load_shouldDoNothingForEmptyInput() {
        assertEquals(0, loader(1000).load(List.of()));
        verify(dataRepository, never()).insertBatch(anyList());
    }

    @Test
    void constructor_shouldRejectNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> loader(0));
    }

    private BatchLoader loader(int batchSize) {
        EtlProperties properties = new EtlProperties();
        properties.getLoad().setBatchSize(batchSize);
        return new BatchLoader(dataRepository, transactionTemplate, properties);
    }

    private static List<LoadRecord> records(int count) {
        Instant start = Instant.parse("2025-08-10T00:00:00Z");
        List<LoadRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(new LoadRecord(start.plusSeconds(600L * (i / 8)), (i % 8) + 1, i));
        }
        return records;
    }
}
