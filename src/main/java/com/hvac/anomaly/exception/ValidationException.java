package com.hvac.anomaly.exception;

/**
 * Input readings are malformed: missing identity fields, unsorted within a zone,
 * or duplicate timestamps for the same zone.
 */
public class ValidationException extends DetectionException {

    public ValidationException(String message) {
        super(message);
    }
}
