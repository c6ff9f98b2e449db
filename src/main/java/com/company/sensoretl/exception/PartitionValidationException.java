package com.company.sensoretl.exception;

public class PartitionValidationException extends RuntimeException {
    public PartitionValidationException(String message) {
        super(message);
    }

    public PartitionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
