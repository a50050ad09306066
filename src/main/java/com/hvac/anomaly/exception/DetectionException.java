package com.hvac.anomaly.exception;

/**
 * Base class for failures raised by the detection pipeline.
 */
public abstract class DetectionException extends RuntimeException {

    protected DetectionException(String message) {
        super(message);
    }

    protected DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
