package com.company.sensoretl.service;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.SignalCatalog;
import com.company.sensoretl.domain.SignalName;
import com.company.sensoretl.repository.SignalRepository;
import com.company.sensoretl.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seeds the signal table with the catalog's names. Run explicitly, never from a partition run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalProvisioningService {

    private final SignalRepository signalRepository;
    private final SignalCatalog catalog;
    private final EtlProperties properties;
    private final PartitionOrchestrator orchestrator;

    /**
     * Insert catalog signals missing from the registry and refresh the orchestrator's snapshot.
     *
     * @return names inserted, empty when the registry was already complete
     */
    @Transactional
    public List<String> provisionMissing() {
        Set<String> existing = new HashSet<>(signalRepository.findAllNames());
        String width = TimeUtils.describeWidth(properties.getAggregation().getBucketWidth());

        List<String> inserted = new ArrayList<>();
        for (SignalName signal : catalog.allSignals()) {
            String name = signal.asString();
            if (existing.contains(name)) {
                continue;
            }
            signalRepository.insert(name, signal.getStatKind().getLabel() + " of "
                    + signal.getMetric() + " over " + width + " buckets");
            inserted.add(name);
        }

        if (inserted.isEmpty()) {
            log.info("Signal registry already holds all {} catalog signals", catalog.allSignals().size());
        } else {
            log.info("Provisioned {} signals: {}", inserted.size(), inserted);
        }

        orchestrator.refreshRegistry();
        return inserted;
    }
}
