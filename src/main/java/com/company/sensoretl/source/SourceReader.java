package com.company.sensoretl.source;

import com.company.sensoretl.domain.RawSample;

import java.time.Instant;
import java.util.List;

/**
 * Reads raw minute samples from the source store.
 */
public interface SourceReader {

    /**
     * @param start   inclusive window start
     * @param end     exclusive window end
     * @param metrics metric names to fetch; each must be on the source allow-list
     * @return samples ordered by timestamp, empty when the window has no data
     * @throws com.company.sensoretl.exception.PartitionValidationException for an unknown metric or an empty window
     * @throws com.company.sensoretl.exception.SourceUnavailableException when the source cannot be read in time
     */
    List<RawSample> readSamples(Instant start, Instant end, List<String> metrics);
}
