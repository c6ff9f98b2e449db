package com.company.sensoretl.exception;

/**
 * A load batch was rejected. Batches committed before it stay in the target store.
 */
public class LoadFailureException extends RuntimeException {

    private final int rowsCommitted;
    private final int failedBatch;

    public LoadFailureException(int rowsCommitted, int failedBatch, Throwable cause) {
        super("Load batch " + failedBatch + " failed after " + rowsCommitted + " rows committed: "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.rowsCommitted = rowsCommitted;
        this.failedBatch = failedBatch;
    }

    public int getRowsCommitted() {
        return rowsCommitted;
    }

    public int getFailedBatch() {
        return failedBatch;
    }
}
